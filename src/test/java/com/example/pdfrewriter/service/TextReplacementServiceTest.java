package com.example.pdfrewriter.service;

import com.example.pdfrewriter.service.dto.PageRewriteResult;
import com.example.pdfrewriter.service.dto.ReplacementRequest;
import com.example.pdfrewriter.service.dto.RequestOutcome;
import com.example.pdfrewriter.service.dto.RequestStatus;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.stream.ContentOperation;
import com.example.pdfrewriter.util.stream.ContentStreamTokenizer;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
class TextReplacementServiceTest {

    @Autowired
    private TextReplacementService service;

    private PDDocument document;

    @BeforeEach
    void setUp() throws IOException {
        document = new PDDocument();
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            content.newLineAtOffset(72, 700);
            content.showText("Mercury is the smallest planet.");
            content.endText();
        }
    }

    @AfterEach
    void tearDown() throws IOException {
        document.close();
    }

    private String pageText() throws IOException {
        return new PDFTextStripper().getText(document);
    }

    @Test
    @DisplayName("rewritePage: 替换后页面文本更新")
    void rewritePage_替换() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Mercury", "Mars")));

        RequestOutcome outcome = result.getOutcomes().get(0);
        assertThat(outcome.getStatus()).isEqualTo(RequestStatus.APPLIED);
        assertThat(outcome.getEntries()).hasSize(1);
        assertThat(outcome.getEntries().get(0).getReplacementText()).startsWith("Mars");
        assertThat(pageText()).contains("Mars").contains("smallest planet.").doesNotContain("Mercury");
    }

    @Test
    @DisplayName("rewritePage: 多个请求依次作用在上一次的结果上")
    void rewritePage_多个请求() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0, Arrays.asList(
                new ReplacementRequest("r1", "Mercury", "Mars"),
                new ReplacementRequest("r2", "smallest", "reddest")));

        assertThat(result.getAppliedCount()).isEqualTo(2);
        assertThat(pageText()).contains("reddest").doesNotContain("smallest");
    }

    @Test
    @DisplayName("rewritePage: 找不到目标不影响其他请求")
    void rewritePage_未找到() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0, Arrays.asList(
                new ReplacementRequest("r1", "Pluto", "Ceres"),
                new ReplacementRequest("r2", "Mercury", "Mars")));

        assertThat(result.getOutcomes()).extracting(RequestOutcome::getStatus)
                .containsExactly(RequestStatus.NOT_FOUND, RequestStatus.APPLIED);
    }

    @Test
    @DisplayName("rewritePage: 字体无法编码时不写回")
    void rewritePage_编码失败() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Mercury", "水星")));

        assertThat(result.getOutcomes().get(0).getStatus()).isEqualTo(RequestStatus.EMISSION_FAILED);
        assertThat(pageText()).contains("Mercury");
    }

    @Test
    @DisplayName("rewritePage: 改写后的文档可以保存并重新打开")
    void rewritePage_保存() throws IOException {
        service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Mercury", "Mars")));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);

        try (PDDocument reloaded = Loader.loadPDF(out.toByteArray())) {
            assertThat(new PDFTextStripper().getText(reloaded)).contains("Mars");
        }
    }

    @Test
    @DisplayName("rewritePage: 替换文本过宽时用 Tz 压缩写回")
    void rewritePage_压缩() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Mercury", "Mercurial Interplanetary Body")));

        RequestOutcome outcome = result.getOutcomes().get(0);
        assertThat(outcome.getStatus()).isEqualTo(RequestStatus.APPLIED);
        SpanRewriteEntry entry = outcome.getEntries().get(0);
        assertThat(entry.isRequiresScaling()).isTrue();
        assertThat(entry.getScaleFactor()).isLessThan(1.0);

        List<ContentOperation> operations = ContentStreamTokenizer.readOperations(document.getPage(0));
        List<ContentOperation> tz = new ArrayList<>();
        for (ContentOperation operation : operations) {
            if ("Tz".equals(operation.getOperatorName())) {
                tz.add(operation);
            }
        }
        assertThat(tz).hasSize(2);
        assertThat(((COSNumber) tz.get(0).getOperands().get(0)).floatValue())
                .isCloseTo((float) (entry.getScaleFactor() * 100), within(1e-2f));
        assertThat(((COSNumber) tz.get(1).getOperands().get(0)).floatValue()).isCloseTo(100f, within(1e-6f));
        assertThat(pageText()).contains("Mercurial Interplanetary Body");
    }

    @Test
    @DisplayName("rewritePage: 同一请求再跑一次找不到原文，页面不变")
    void rewritePage_重复执行() throws IOException {
        service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Mercury", "Mars")));
        byte[] before = contentBytes();

        PageRewriteResult again = service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Mercury", "Mars")));

        assertThat(again.getOutcomes().get(0).getStatus()).isEqualTo(RequestStatus.NOT_FOUND);
        assertThat(contentBytes()).isEqualTo(before);
        assertThat(pageText()).contains("Mars is the smallest planet.");
    }

    private byte[] contentBytes() throws IOException {
        try (InputStream in = document.getPage(0).getContents()) {
            return in.readAllBytes();
        }
    }
}

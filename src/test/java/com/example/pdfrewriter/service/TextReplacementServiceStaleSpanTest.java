package com.example.pdfrewriter.service;

import com.example.pdfrewriter.service.dto.PageRewriteResult;
import com.example.pdfrewriter.service.dto.ReplacementRequest;
import com.example.pdfrewriter.service.dto.RequestOutcome;
import com.example.pdfrewriter.service.dto.RequestStatus;
import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.span.dto.CharBox;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.PageFonts;
import com.example.pdfrewriter.util.stream.dto.PageAnalysis;
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
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;

/**
 * 一个 span 的文本已经和内容流对不上（比如被别的流程改过）时，只跳过这个 span
 */
@SpringBootTest
class TextReplacementServiceStaleSpanTest {

    @Autowired
    private TextReplacementService service;

    @SpyBean
    private PageAnalysisService analysisService;

    private PDDocument document;

    @BeforeEach
    void setUp() throws IOException {
        document = new PDDocument();
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.newLineAtOffset(72, 700);
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            content.showText("Mercury");
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), 12);
            content.showText("Venus");
            content.endText();
        }

        // 视觉上 "Venus" 那个 span 已经变成 "Vesta"
        doAnswer(invocation -> staleSpan((PageAnalysis) invocation.callRealMethod(), "Venus", "Vesta"))
                .when(analysisService).analyze(any(PDDocument.class), anyInt(), anyList(), any(PageFonts.class));
    }

    @AfterEach
    void tearDown() throws IOException {
        document.close();
    }

    @Test
    @DisplayName("rewritePage: 校验失败的 span 跳过，其余 span 照常写回")
    void rewritePage_部分写回() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "MercuryVenus", "MarsPluto")));

        RequestOutcome outcome = result.getOutcomes().get(0);
        assertThat(outcome.getStatus()).isEqualTo(RequestStatus.PARTIALLY_APPLIED);
        assertThat(outcome.isApplied()).isTrue();
        assertThat(outcome.getValidationFailures()).hasSize(1);
        assertThat(outcome.getValidationFailures().get(0).getExpected()).isEqualTo("Venus");
        assertThat(outcome.getValidationFailures().get(0).getObserved()).isEqualTo("Vesta");
        assertThat(outcome.getEntries()).hasSize(1);

        String text = new PDFTextStripper().getText(document);
        assertThat(text).doesNotContain("Mercury").contains("Venus");
    }

    @Test
    @DisplayName("rewritePage: 只涉及校验失败的 span 时整个请求不写回")
    void rewritePage_全部失败() throws IOException {
        PageRewriteResult result = service.rewritePage(document, 0,
                Collections.singletonList(new ReplacementRequest("r1", "Venus", "Pluto")));

        RequestOutcome outcome = result.getOutcomes().get(0);
        assertThat(outcome.getStatus()).isEqualTo(RequestStatus.VALIDATION_FAILED);
        assertThat(new PDFTextStripper().getText(document)).contains("MercuryVenus");
    }

    private static PageAnalysis staleSpan(PageAnalysis analysis, String text, String staleText) {
        Map<SpanRecord, SpanRecord> replaced = new LinkedHashMap<>();
        List<SpanRecord> spans = new ArrayList<>();
        for (SpanRecord span : analysis.getSpans()) {
            SpanRecord copy = text.equals(span.getText()) ? withText(span, staleText) : span;
            replaced.put(span, copy);
            spans.add(copy);
        }
        Map<Integer, List<SpanSlice>> alignment = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<SpanSlice>> entry : analysis.getAlignment().entrySet()) {
            List<SpanSlice> slices = new ArrayList<>();
            for (SpanSlice slice : entry.getValue()) {
                slices.add(new SpanSlice(replaced.get(slice.getSpan()), slice.getStart(), slice.getEnd()));
            }
            alignment.put(entry.getKey(), slices);
        }
        return new PageAnalysis(analysis.getPageIndex(), analysis.getRecords(), spans, alignment);
    }

    private static SpanRecord withText(SpanRecord span, String text) {
        List<CharBox> chars = new ArrayList<>();
        for (int i = 0; i < span.getCharacters().size(); i++) {
            chars.add(span.getCharacters().get(i).withText(String.valueOf(text.charAt(i))));
        }
        return SpanRecord.fromCharacters(span.getPageIndex(), span.getBlockIndex(), span.getLineIndex(),
                span.getSpanIndex(), span.getFont(), span.getFontSize(), span.getOriginX(), span.getOriginY(),
                new double[]{span.getDirectionX(), span.getDirectionY()}, chars);
    }
}

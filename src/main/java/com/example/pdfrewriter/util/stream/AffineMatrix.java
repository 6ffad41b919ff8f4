package com.example.pdfrewriter.util.stream;

import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.util.Matrix;

import java.util.List;

/**
 * 2×3 仿射矩阵（不可变）
 *
 * <h3>分量约定</h3>
 * 与 PDF 规范一致，矩阵写作 [a b c d e f]，对应
 * <pre>
 * | a  b  0 |
 * | c  d  0 |
 * | e  f  1 |
 * </pre>
 *
 * <h3>组合顺序</h3>
 * {@link #compose(AffineMatrix)} 计算 {@code this ∘ other}：先应用 other，再应用 this。
 * <ul>
 *   <li>cm：CTM' = CTM ∘ operand</li>
 *   <li>Td/T*：Tlm' = Tlm ∘ translate(tx, ty)</li>
 *   <li>世界坐标：CTM ∘ Tm</li>
 * </ul>
 *
 * 选用不可变值类型而不是 PDFBox 的 {@link Matrix}（可变），
 * 这样状态快照入栈/出栈时不会出现别名修改。
 */
public final class AffineMatrix {

    private static final AffineMatrix IDENTITY = new AffineMatrix(1, 0, 0, 1, 0, 0);

    private final double a;
    private final double b;
    private final double c;
    private final double d;
    private final double e;
    private final double f;

    public AffineMatrix(double a, double b, double c, double d, double e, double f) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
        this.e = e;
        this.f = f;
    }

    public static AffineMatrix identity() {
        return IDENTITY;
    }

    public static AffineMatrix translation(double tx, double ty) {
        return new AffineMatrix(1, 0, 0, 1, tx, ty);
    }

    /**
     * 从操作数构造矩阵（cm / Tm）
     *
     * 操作数不足 6 个时补 0，非数值操作数按 0 处理，不抛异常。
     *
     * @param operands 操作数列表
     * @return 矩阵
     */
    public static AffineMatrix fromOperands(List<COSBase> operands) {
        double[] values = new double[6];
        if (operands != null) {
            for (int i = 0; i < 6 && i < operands.size(); i++) {
                COSBase operand = operands.get(i);
                if (operand instanceof COSNumber) {
                    values[i] = ((COSNumber) operand).floatValue();
                }
            }
        }
        return new AffineMatrix(values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    /**
     * 从 PDFBox 矩阵转换（TextPosition.getTextMatrix() 等）
     */
    public static AffineMatrix fromPdfBox(Matrix matrix) {
        if (matrix == null) {
            return IDENTITY;
        }
        return new AffineMatrix(
                matrix.getScaleX(), matrix.getShearY(),
                matrix.getShearX(), matrix.getScaleY(),
                matrix.getTranslateX(), matrix.getTranslateY());
    }

    public Matrix toPdfBox() {
        return new Matrix((float) a, (float) b, (float) c, (float) d, (float) e, (float) f);
    }

    /**
     * this ∘ other
     */
    public AffineMatrix compose(AffineMatrix other) {
        return new AffineMatrix(
                a * other.a + c * other.b,
                b * other.a + d * other.b,
                a * other.c + c * other.d,
                b * other.c + d * other.d,
                a * other.e + c * other.f + e,
                b * other.e + d * other.f + f);
    }

    /**
     * 在本矩阵的坐标系内平移：this ∘ translate(dx, dy)
     */
    public AffineMatrix translate(double dx, double dy) {
        return compose(translation(dx, dy));
    }

    public boolean isIdentity(double tolerance) {
        return Math.abs(a - 1) <= tolerance && Math.abs(b) <= tolerance
                && Math.abs(c) <= tolerance && Math.abs(d - 1) <= tolerance
                && Math.abs(e) <= tolerance && Math.abs(f) <= tolerance;
    }

    public boolean hasZeroTranslation(double tolerance) {
        return Math.abs(e) <= tolerance && Math.abs(f) <= tolerance;
    }

    public double getA() {
        return a;
    }

    public double getB() {
        return b;
    }

    public double getC() {
        return c;
    }

    public double getD() {
        return d;
    }

    public double getE() {
        return e;
    }

    public double getF() {
        return f;
    }

    public double[] toArray() {
        return new double[]{a, b, c, d, e, f};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AffineMatrix)) {
            return false;
        }
        AffineMatrix that = (AffineMatrix) o;
        return Double.compare(a, that.a) == 0 && Double.compare(b, that.b) == 0
                && Double.compare(c, that.c) == 0 && Double.compare(d, that.d) == 0
                && Double.compare(e, that.e) == 0 && Double.compare(f, that.f) == 0;
    }

    @Override
    public int hashCode() {
        int result = 17;
        for (double v : toArray()) {
            long bits = Double.doubleToLongBits(v);
            result = 31 * result + (int) (bits ^ (bits >>> 32));
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("[%.3f %.3f %.3f %.3f %.3f %.3f]", a, b, c, d, e, f);
    }
}

package ca.weblite.qrstudio.zxing;

import ca.weblite.qrstudio.ErrorCorrection;
import ca.weblite.qrstudio.QrSymbol;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.google.zxing.qrcode.decoder.Mode;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.QRCode;

/**
 * {@link QrSymbol} backed by a ZXing {@link QRCode}.
 */
public final class ZxingQrSymbol implements QrSymbol {

    private final QRCode qrCode;
    private final ByteMatrix matrix;

    ZxingQrSymbol(QRCode qrCode) {
        this.qrCode = qrCode;
        this.matrix = qrCode.getMatrix();
    }

    @Override
    public int getSize() {
        return matrix.getWidth();
    }

    @Override
    public boolean isDark(int x, int y) {
        return matrix.get(x, y) == 1;
    }

    @Override
    public int getVersion() {
        return qrCode.getVersion().getVersionNumber();
    }

    @Override
    public ErrorCorrection getErrorCorrection() {
        return fromZxing(qrCode.getECLevel());
    }

    /**
     * @return the segment mode ZXing chose for the payload
     */
    public Mode getMode() {
        return qrCode.getMode();
    }

    @Override
    public String describe() {
        return qrCode.toString();
    }

    static ErrorCorrectionLevel toZxing(ErrorCorrection level) {
        switch (level) {
            case LOW:
                return ErrorCorrectionLevel.L;
            case MEDIUM:
                return ErrorCorrectionLevel.M;
            case QUARTILE:
                return ErrorCorrectionLevel.Q;
            case HIGH:
                return ErrorCorrectionLevel.H;
            default:
                throw new IllegalArgumentException("No fixed ZXing level for " + level);
        }
    }

    static ErrorCorrection fromZxing(ErrorCorrectionLevel level) {
        switch (level) {
            case L:
                return ErrorCorrection.LOW;
            case M:
                return ErrorCorrection.MEDIUM;
            case Q:
                return ErrorCorrection.QUARTILE;
            case H:
                return ErrorCorrection.HIGH;
            default:
                throw new IllegalArgumentException("Unknown ZXing level " + level);
        }
    }
}

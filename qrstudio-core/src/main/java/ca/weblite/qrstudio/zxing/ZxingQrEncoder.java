package ca.weblite.qrstudio.zxing;

import ca.weblite.qrstudio.EncodingMode;
import ca.weblite.qrstudio.ErrorCorrection;
import ca.weblite.qrstudio.GenerationRequest;
import ca.weblite.qrstudio.QrEncoder;
import ca.weblite.qrstudio.QrSymbol;
import ca.weblite.qrstudio.QrValidationException;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * {@link QrEncoder} backed by ZXing's QR encoder.
 *
 * <p>Text is encoded as UTF-8 unless {@link EncodingMode#KANJI} is requested, in
 * which case Shift_JIS is used so ZXing selects its kanji segment mode.</p>
 *
 * <p>An explicit {@link EncodingMode} is a constraint on the content: text with
 * characters outside the mode is rejected. ZXing then picks the densest mode that
 * encodes the text, so digits requested as {@link EncodingMode#ALPHANUMERIC} still
 * end up in a numeric segment.</p>
 */
public class ZxingQrEncoder implements QrEncoder {

    static final Charset SHIFT_JIS = Charset.forName("Shift_JIS");

    private static final String ALPHANUMERIC_CHARS = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ $%*+-./:";

    // AUTO tries these in order at the version the content needs at LOW
    private static final ErrorCorrection[] AUTO_LEVELS = {
            ErrorCorrection.HIGH, ErrorCorrection.QUARTILE, ErrorCorrection.MEDIUM, ErrorCorrection.LOW
    };

    @Override
    public QrSymbol encode(String text, ErrorCorrection errorCorrection, int version, EncodingMode mode)
            throws QrValidationException {
        checkMode(text, mode);
        if (errorCorrection == ErrorCorrection.AUTO) {
            return encodeWithBestLevel(text, version, mode);
        }
        try {
            return new ZxingQrSymbol(encodeAt(text, errorCorrection, version, mode));
        } catch (WriterException e) {
            throw tooBig(errorCorrection, version, e);
        }
    }

    private QrSymbol encodeWithBestLevel(String text, int version, EncodingMode mode) throws QrValidationException {
        int targetVersion = version;
        if (targetVersion == GenerationRequest.AUTO_VERSION) {
            try {
                targetVersion = encodeAt(text, ErrorCorrection.LOW, version, mode)
                        .getVersion().getVersionNumber();
            } catch (WriterException e) {
                throw tooBig(ErrorCorrection.LOW, version, e);
            }
        }

        WriterException last = null;
        for (ErrorCorrection level : AUTO_LEVELS) {
            try {
                return new ZxingQrSymbol(encodeAt(text, level, targetVersion, mode));
            } catch (WriterException e) {
                last = e;
            }
        }
        throw tooBig(ErrorCorrection.LOW, version, last);
    }

    private QRCode encodeAt(String text, ErrorCorrection level, int version, EncodingMode mode)
            throws WriterException {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.CHARACTER_SET, mode == EncodingMode.KANJI ? SHIFT_JIS.name() : StandardCharsets.UTF_8.name());
        if (version != GenerationRequest.AUTO_VERSION) {
            hints.put(EncodeHintType.QR_VERSION, version);
        }
        return Encoder.encode(text, ZxingQrSymbol.toZxing(level), hints);
    }

    /**
     * Rejects text that contains characters the requested mode cannot represent.
     */
    static void checkMode(String text, EncodingMode mode) throws QrValidationException {
        switch (mode) {
            case NUMERIC:
                for (int i = 0; i < text.length(); i++) {
                    char c = text.charAt(i);
                    if (c < '0' || c > '9') {
                        throw invalidCharacter(mode, text.codePointAt(i));
                    }
                }
                break;
            case ALPHANUMERIC:
                for (int i = 0; i < text.length(); i++) {
                    if (ALPHANUMERIC_CHARS.indexOf(text.charAt(i)) < 0) {
                        throw invalidCharacter(mode, text.codePointAt(i));
                    }
                }
                break;
            case KANJI:
                int offset = 0;
                while (offset < text.length()) {
                    int codePoint = text.codePointAt(offset);
                    if (!isShiftJisKanji(codePoint)) {
                        throw invalidCharacter(mode, codePoint);
                    }
                    offset += Character.charCount(codePoint);
                }
                break;
            default:
                break;
        }
    }

    static boolean isShiftJisKanji(int codePoint) {
        String s = new String(Character.toChars(codePoint));
        if (!SHIFT_JIS.newEncoder().canEncode(s)) {
            return false;
        }
        byte[] bytes = s.getBytes(SHIFT_JIS);
        if (bytes.length != 2) {
            return false;
        }
        int code = ((bytes[0] & 0xFF) << 8) | (bytes[1] & 0xFF);
        return (code >= 0x8140 && code <= 0x9FFC) || (code >= 0xE040 && code <= 0xEBBF);
    }

    private static QrValidationException invalidCharacter(EncodingMode mode, int codePoint) {
        return new QrValidationException("Character '" + new String(Character.toChars(codePoint))
                + "' cannot be encoded in " + mode + " mode");
    }

    private static QrValidationException tooBig(ErrorCorrection level, int version, WriterException cause) {
        String message = version == GenerationRequest.AUTO_VERSION
                ? "Text is too long for any QR version at error correction " + level
                : "Text does not fit in version " + version + " at error correction " + level;
        return new QrValidationException(message, cause);
    }
}

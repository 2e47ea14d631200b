package nl.bytesoflife.deltaspice.util;

import java.io.IOException;

public class EncodingDetectException extends IOException {

    public EncodingDetectException(String message) {
        super(message);
    }
}

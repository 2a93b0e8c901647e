package no.cantara.standards;

/**
 * Thrown when a corpus document or one of its entries is malformed.
 */
public class CorpusFormatException extends IllegalArgumentException {

    public CorpusFormatException(String message) {
        super(message);
    }

    public CorpusFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

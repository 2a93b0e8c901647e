package no.cantara.standards;

/**
 * Thrown when the corpus source as a whole cannot be read, e.g. the directory is missing.
 * Problems with individual accreditor files are reported as
 * {@link no.cantara.standards.model.LoadFailure}s instead.
 */
public class CorpusLoadException extends RuntimeException {

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package no.cantara.standards.model;

/**
 * One corpus file that could not be loaded.
 *
 * @param accreditor the accreditor code the file declares, or its upper-cased file stem
 *                   when the document could not be read far enough to tell
 */
public record LoadFailure(
        String file,
        String accreditor,
        String message
) {}

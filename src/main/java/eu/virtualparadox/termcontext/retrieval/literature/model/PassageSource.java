package eu.virtualparadox.termcontext.retrieval.literature.model;

/**
 * @param id    Identifier of the record at the source (e.g. an arXiv abstract URL).
 * @param title Title of the record, may be empty.
 * @param link  Link the passage text was taken from, may be {@code null}.
 */
public record PassageSource(String id, String title, String link) {

}

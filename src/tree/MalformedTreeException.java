package tree;

/**
 * Thrown when a tree string cannot be read: unbalanced parentheses, an empty
 * leaf label or an internal node label that is not a support count.
 */
public class MalformedTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, int position) {
        super(message + " (at character " + position + ")");
    }
}

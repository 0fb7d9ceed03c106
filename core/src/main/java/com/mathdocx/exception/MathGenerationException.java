package com.mathdocx.exception;

import com.mathdocx.expression.MathNode;

/**
 * Exception thrown when a generator cannot render a tree.
 *
 * <p>Trees built by the parsers always satisfy the generators' preconditions,
 * so this signals a bug rather than bad input. Not a
 * {@link MathConversionException}; the converter's text fallback does not catch it.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String omml = generator.generate(tree);
 *   } catch (MathGenerationException e) {
 *       logger.error(e.getTechnicalMessage());
 *       throw e;
 *   }
 * </pre>
 */
public class MathGenerationException extends RuntimeException {

    private final MathNode failedNode;

    /**
     * Creates a generation exception.
     *
     * @param message the error message
     * @param node the node that could not be rendered
     */
    public MathGenerationException(String message, MathNode node) {
        super(message + " (node kind: " + (node != null ? node.kind() : "null") + ")");
        this.failedNode = node;
    }

    /**
     * Creates a generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param node the node that could not be rendered
     */
    public MathGenerationException(String message, Throwable cause, MathNode node) {
        super(message + " (node kind: " + (node != null ? node.kind() : "null") + ")", cause);
        this.failedNode = node;
    }

    /**
     * Returns the node that failed to render.
     *
     * @return the failed node, or null if not available
     */
    public MathNode getFailedNode() {
        return failedNode;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Math Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedNode != null) {
            sb.append("Failed Node Type: ").append(failedNode.getClass().getName()).append("\n");
            sb.append("Node String: ").append(failedNode).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}

package fun.fengwk.mfr.core.service.extract.model;

/**
 * Handling rule assigned to a markup node, in priority order.
 *
 * @author fengwk
 */
public enum NodeRule {

    /**
     * Collect the full resolution source, emit nothing.
     */
    IMAGE,
    LINK,
    EMBEDDED_FRAME,
    HEADING,
    QUOTATION,
    LINE_BREAK,

    /**
     * Span-like node, subject to trailer suppression and the class denylist.
     */
    INLINE_CONTAINER,

    /**
     * Div-like node, subject to the class denylist.
     */
    BLOCK_CONTAINER,
    BOLD,
    ITALIC,

    /**
     * Paragraph that carries its own leading text.
     */
    PARAGRAPH,

    /**
     * Script, style and noscript nodes.
     */
    SKIPPED,

    /**
     * Any other node, walked as a plain wrapper.
     */
    TRANSPARENT

}

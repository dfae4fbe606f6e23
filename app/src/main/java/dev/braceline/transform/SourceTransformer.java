package dev.braceline.transform;

/**
 * Rewrites a complete source string in one pass.
 */
public interface SourceTransformer {

    /**
     * @throws StructureException when the source closes more blocks than it opens
     */
    String transform(String source);
}

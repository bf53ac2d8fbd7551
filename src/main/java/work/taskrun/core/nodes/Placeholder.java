package work.taskrun.core.nodes;

/**
 * Anonymous top-level slot created during normalization and replaced by an ordinal when merging.
 *
 * @param scalar whether the slot holds a bare reference rather than an element of a collection
 * @param token identifier unique within one {@link NodeNormalizer}
 */
record Placeholder(boolean scalar, long token) implements NodeKey {
    @Override
    public boolean isExplicit() {
        return false;
    }

    @Override
    public String toString() {
        return "<placeholder#" + token + (scalar ? ",scalar>" : ">");
    }
}

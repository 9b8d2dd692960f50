package io.stpp.parser.api;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The mutable state of one preprocessing run: the set of defined tags and the current
 * conditional nesting depth.
 *
 * <p>Tags are opaque, case-sensitive names. A context is owned by a single run and is not
 * thread-safe.
 */
public final class TagContext {
    private final Set<String> tags;
    private int depth;

    /** Creates an empty context. */
    public TagContext() {
        this(Set.of());
    }

    /**
     * Creates a context seeded with predefined tags.
     *
     * @param predefined the initially defined tags
     */
    public TagContext(Collection<String> predefined) {
        this.tags = new HashSet<>(Objects.requireNonNull(predefined, "predefined"));
    }

    /**
     * Defines a tag.
     *
     * @param tag the tag name
     * @return {@code true} if the tag was not defined before
     */
    public boolean define(String tag) {
        return tags.add(tag);
    }

    /**
     * Removes a tag.
     *
     * @param tag the tag name
     * @return {@code true} if the tag was defined
     */
    public boolean undefine(String tag) {
        return tags.remove(tag);
    }

    public boolean isDefined(String tag) {
        return tags.contains(tag);
    }

    /** Returns a read-only view of the defined tags. */
    public Set<String> tags() {
        return Collections.unmodifiableSet(tags);
    }

    public int depth() {
        return depth;
    }

    /** Records entry into a conditional block. */
    public void enterBlock() {
        depth++;
    }

    /** Records exit from a conditional block. */
    public void leaveBlock() {
        if (depth == 0) {
            throw new IllegalStateException("leaveBlock without enterBlock");
        }
        depth--;
    }

    @Override
    public String toString() {
        return "TagContext{tags=" + tags + ", depth=" + depth + "}";
    }
}

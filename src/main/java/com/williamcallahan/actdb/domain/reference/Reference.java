package com.williamcallahan.actdb.domain.reference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.identifier.IdentifierRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Path expression identifying zero or more positions in an act.
 *
 * <p>Every part is optional. Gaps are allowed: a point of an article with a single,
 * unnumbered paragraph has an article and a point but no paragraph. Each present part may be
 * a single identifier or an inclusive range.</p>
 *
 * @param act act the reference points into, or null for an act-relative reference
 * @param article article part
 * @param paragraph paragraph part
 * @param point point part (alphabetic or numeric)
 * @param subpoint subpoint part (alphabetic or numeric)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Reference(
        ActIdentifier act,
        IdentifierRange article,
        IdentifierRange paragraph,
        IdentifierRange point,
        IdentifierRange subpoint) {

    private static final Reference EMPTY = new Reference(null, null, null, null, null);

    public static Reference empty() {
        return EMPTY;
    }

    public static Reference toAct(ActIdentifier act) {
        return new Reference(Objects.requireNonNull(act, "Act identifier is required"), null, null, null, null);
    }

    public static Reference toArticle(String article) {
        return EMPTY.withArticle(article);
    }

    public Reference withAct(ActIdentifier newAct) {
        return new Reference(newAct, article, paragraph, point, subpoint);
    }

    public Reference withArticle(String id) {
        return withPart(ReferenceLevel.ARTICLE, IdentifierRange.single(id));
    }

    public Reference withArticleRange(String first, String last) {
        return withPart(ReferenceLevel.ARTICLE, IdentifierRange.of(first, last));
    }

    public Reference withParagraph(String id) {
        return withPart(ReferenceLevel.PARAGRAPH, IdentifierRange.single(id));
    }

    public Reference withPoint(String id) {
        return withPart(ReferenceLevel.POINT, IdentifierRange.single(id));
    }

    public Reference withPointRange(String first, String last) {
        return withPart(ReferenceLevel.POINT, IdentifierRange.of(first, last));
    }

    public Reference withSubpoint(String id) {
        return withPart(ReferenceLevel.SUBPOINT, IdentifierRange.single(id));
    }

    /**
     * Returns a copy with the given sub-act level replaced.
     *
     * @param level level to set; must not be {@link ReferenceLevel#ACT}
     * @param range new value of the level, may be null to clear it
     * @return updated reference
     */
    public Reference withPart(ReferenceLevel level, IdentifierRange range) {
        return switch (level) {
            case ACT -> throw new IllegalArgumentException("Use withAct to change the act part");
            case ARTICLE -> new Reference(act, range, paragraph, point, subpoint);
            case PARAGRAPH -> new Reference(act, article, range, point, subpoint);
            case POINT -> new Reference(act, article, paragraph, range, subpoint);
            case SUBPOINT -> new Reference(act, article, paragraph, point, range);
        };
    }

    public Reference withoutAct() {
        return act == null ? this : new Reference(null, article, paragraph, point, subpoint);
    }

    /**
     * Returns the part at the given level, or null if absent. The act level is never returned here.
     *
     * @param level sub-act level
     * @return the part at that level
     */
    public IdentifierRange part(ReferenceLevel level) {
        return switch (level) {
            case ACT -> null;
            case ARTICLE -> article;
            case PARAGRAPH -> paragraph;
            case POINT -> point;
            case SUBPOINT -> subpoint;
        };
    }

    /**
     * Returns the innermost level present, {@link ReferenceLevel#ACT} if only the act is set,
     * or null for an empty reference.
     *
     * @return innermost level
     */
    @JsonIgnore
    public ReferenceLevel lastLevel() {
        ReferenceLevel result = act == null ? null : ReferenceLevel.ACT;
        for (ReferenceLevel level : subActLevels()) {
            if (part(level) != null) {
                result = level;
            }
        }
        return result;
    }

    @JsonIgnore
    public ReferenceLevel firstLevel() {
        if (act != null) {
            return ReferenceLevel.ACT;
        }
        for (ReferenceLevel level : subActLevels()) {
            if (part(level) != null) {
                return level;
            }
        }
        return null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return lastLevel() == null;
    }

    /**
     * Reports whether every position matched by {@code other} is matched by this reference.
     *
     * <p>Acts are compared only if both references carry one. Each part present here must also be
     * present in {@code other} and must include it as a range; parts that only overlap do not count.</p>
     *
     * @param other reference to test
     * @return true if this reference contains {@code other}
     */
    public boolean contains(Reference other) {
        if (other == null) {
            return false;
        }
        if (act != null && other.act != null && !act.equals(other.act)) {
            return false;
        }
        for (ReferenceLevel level : subActLevels()) {
            IdentifierRange mine = part(level);
            if (mine == null) {
                continue;
            }
            IdentifierRange theirs = other.part(level);
            if (theirs == null || !mine.contains(theirs)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves a relative reference against a base: every level above this reference's first
     * part is taken from {@code base}. References that already carry an act are returned as is.
     *
     * @param base reference to resolve against
     * @return resolved reference
     */
    public Reference relativeTo(Reference base) {
        if (act != null || base == null) {
            return this;
        }
        ReferenceLevel first = firstLevel();
        Reference result = new Reference(base.act, null, null, null, null);
        for (ReferenceLevel level : subActLevels()) {
            boolean fromBase = first == null || level.compareTo(first) < 0;
            result = result.withPart(level, fromBase ? base.part(level) : part(level));
        }
        return result;
    }

    /**
     * Drops the innermost part.
     *
     * @return parent reference
     * @throws IllegalStateException for an empty reference
     */
    public Reference parent() {
        ReferenceLevel last = lastLevel();
        if (last == null) {
            throw new IllegalStateException("Empty reference has no parent");
        }
        if (last == ReferenceLevel.ACT) {
            return EMPTY;
        }
        return withPart(last, null);
    }

    /**
     * Returns the innermost part, or null if the reference has no sub-act part.
     *
     * @return innermost part
     */
    @JsonIgnore
    public IdentifierRange lastPart() {
        ReferenceLevel last = lastLevel();
        return last == null ? null : part(last);
    }

    /**
     * Reports whether the article part is a single article and nothing deeper is addressed
     * as a range.
     *
     * @return true if exactly one article is addressed
     */
    @JsonIgnore
    public boolean isSingleArticle() {
        return article != null && !article.isRange();
    }

    /**
     * Reports whether this is a reference to a bare article: an act, one article, nothing deeper.
     *
     * @return true for {@code act + single article}
     */
    @JsonIgnore
    public boolean isBareArticle() {
        return isSingleArticle() && paragraph == null && point == null && subpoint == null;
    }

    public Identifier singleArticleId() {
        if (!isSingleArticle()) {
            throw new IllegalStateException("Reference does not address a single article: " + this);
        }
        return article.first();
    }

    private static ReferenceLevel[] subActLevels() {
        return new ReferenceLevel[] {
            ReferenceLevel.ARTICLE, ReferenceLevel.PARAGRAPH, ReferenceLevel.POINT, ReferenceLevel.SUBPOINT
        };
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        if (act != null) {
            parts.add(act.toString());
        }
        if (article != null) {
            parts.add(article + ". §");
        }
        if (paragraph != null) {
            parts.add("(" + paragraph + ")");
        }
        if (point != null) {
            parts.add(point + ")");
        }
        if (subpoint != null) {
            parts.add(subpoint + ")");
        }
        return parts.isEmpty() ? "<empty reference>" : String.join(" ", parts);
    }
}

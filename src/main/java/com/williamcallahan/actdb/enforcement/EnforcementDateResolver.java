package com.williamcallahan.actdb.enforcement;

import com.williamcallahan.actdb.domain.identifier.IdentifierRange;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.ReferenceLevel;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.semantic.EnforcementDateType;
import com.williamcallahan.actdb.domain.semantic.SpecialPhrase;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.structure.CutPointResolver;
import com.williamcallahan.actdb.structure.CutPoints;
import com.williamcallahan.actdb.structure.ReferenceResolutionException;
import com.williamcallahan.actdb.util.SaeWalker;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers "when does this position of the act take effect".
 *
 * <p>Built once per act version from every enforcement-date phrase in the act plus any
 * additional dates supplied by fixups. Exactly one phrase must be position-less: it gives the
 * default date of the act. Every other entry overrides the default for the positions it governs;
 * when entries overlap, the one stated later in the act wins.</p>
 */
public final class EnforcementDateResolver {

    private final LocalDate defaultDate;
    private final List<ResolvedEnforcementDate> overrides;

    private EnforcementDateResolver(LocalDate defaultDate, List<ResolvedEnforcementDate> overrides) {
        this.defaultDate = defaultDate;
        this.overrides = List.copyOf(overrides);
    }

    /**
     * Positions governed by one enforcement-date phrase, with the date resolved.
     *
     * @param positions act-relative positions
     * @param date absolute date
     */
    record ResolvedEnforcementDate(List<Reference> positions, LocalDate date) {
    }

    /**
     * Collects the enforcement dates of the act.
     *
     * @param act act to analyse
     * @param additionalDates extra enforcement dates from fixups, appended after the act's own
     * @return resolver for the act
     * @throws EnforcementDateException if the dates are inconsistent or cannot be resolved
     */
    public static EnforcementDateResolver fromAct(Act act, List<SpecialPhrase.EnforcementDate> additionalDates) {
        List<SpecialPhrase.EnforcementDate> phrases = new ArrayList<>();
        for (SaeWalker.PositionedSae positioned : SaeWalker.walk(act)) {
            if (positioned.element().semanticInfo().specialPhrase() instanceof SpecialPhrase.EnforcementDate ed) {
                phrases.add(ed);
            }
        }
        if (additionalDates != null) {
            phrases.addAll(additionalDates);
        }
        try {
            return fromEnforcementDates(phrases, act);
        } catch (EnforcementDateException e) {
            throw new EnforcementDateException("Calculating enforcement dates failed for " + act.identifier(), e);
        }
    }

    /**
     * Builds a resolver from already collected phrases.
     *
     * @param phrases enforcement-date phrases in document order
     * @param act act the phrases belong to
     * @return resolver
     * @throws EnforcementDateException if there is not exactly one default date, or an override
     *                                  precedes the default date
     */
    public static EnforcementDateResolver fromEnforcementDates(List<SpecialPhrase.EnforcementDate> phrases, Act act) {
        LocalDate defaultDate = null;
        List<ResolvedEnforcementDate> overrides = new ArrayList<>();
        for (SpecialPhrase.EnforcementDate phrase : phrases) {
            ResolvedEnforcementDate resolved = resolve(phrase, act);
            if (resolved.positions().isEmpty()) {
                if (defaultDate != null) {
                    throw new EnforcementDateException("Found too many default enforcement dates (first: "
                            + defaultDate + ", second: " + resolved.date() + ")");
                }
                defaultDate = resolved.date();
            } else {
                overrides.add(resolved);
            }
        }
        if (defaultDate == null) {
            throw new EnforcementDateException(
                    "Could not find the default enforcement date (out of " + phrases.size() + ")");
        }
        for (ResolvedEnforcementDate override : overrides) {
            if (override.date().isBefore(defaultDate)) {
                throw new EnforcementDateException("Enforcement date " + override.date() + " of "
                        + override.positions() + " precedes the default date " + defaultDate);
            }
        }
        return new EnforcementDateResolver(defaultDate, overrides);
    }

    /**
     * Returns the date the position takes effect. The act part of the position is ignored.
     *
     * @param position position to look up
     * @return effective date
     */
    public LocalDate effectiveDate(Reference position) {
        Reference relative = position.withoutAct();
        LocalDate result = defaultDate;
        for (ResolvedEnforcementDate override : overrides) {
            for (Reference governed : override.positions()) {
                if (governed.contains(relative)) {
                    result = override.date();
                }
            }
        }
        return result;
    }

    public boolean isInForce(Reference position, LocalDate onDate) {
        return !effectiveDate(position).isAfter(onDate);
    }

    public boolean cameIntoForceToday(Reference position, LocalDate onDate) {
        return effectiveDate(position).equals(onDate);
    }

    public boolean cameIntoForceYesterday(Reference position, LocalDate onDate) {
        return effectiveDate(position).equals(onDate.minusDays(1));
    }

    /**
     * Returns the future enforcement date of a position that is explicitly named by an override
     * (at its own level) and not yet in force. Children of named positions are not reported.
     *
     * @param position position to look up
     * @param onDate date of the act version being viewed
     * @return the date the position takes effect, if it is specifically not yet in force
     */
    public Optional<LocalDate> specificElementNotInForce(Reference position, LocalDate onDate) {
        Reference relative = position.withoutAct();
        ReferenceLevel level = relative.lastLevel();
        return overrides.stream()
                .filter(override -> override.date().isAfter(onDate))
                .filter(override -> override.positions().stream()
                        .anyMatch(governed -> governed.lastLevel() == level && governed.contains(relative)))
                .map(ResolvedEnforcementDate::date)
                .findFirst();
    }

    /**
     * Returns every distinct date on which some part of the act takes effect, default included.
     *
     * @return enforcement dates, overrides first, default last
     */
    public List<LocalDate> allDates() {
        List<LocalDate> result = new ArrayList<>();
        for (ResolvedEnforcementDate override : overrides) {
            if (!result.contains(override.date())) {
                result.add(override.date());
            }
        }
        if (!result.contains(defaultDate)) {
            result.add(defaultDate);
        }
        return result;
    }

    public LocalDate defaultDate() {
        return defaultDate;
    }

    private static ResolvedEnforcementDate resolve(SpecialPhrase.EnforcementDate phrase, Act act) {
        List<Reference> positions = new ArrayList<>();
        for (Reference position : phrase.positions()) {
            if (position.act() != null) {
                throw new EnforcementDateException("Enforcement date position contained an act: " + position);
            }
            positions.add(position);
        }
        for (StructuralReference structural : phrase.structuralPositions()) {
            if (structural.act() != null) {
                throw new EnforcementDateException(
                        "Enforcement date structural position contained an act: " + structural);
            }
            positions.add(structuralToArticleRange(structural, act));
        }
        return new ResolvedEnforcementDate(positions, convertDate(phrase.date(), act.publicationDate()));
    }

    /**
     * Resolves a date kind relative to the publication date.
     *
     * @param type declared date
     * @param publicationDate publication date of the act
     * @return absolute date
     * @throws EnforcementDateException for {@link EnforcementDateType.Special}
     */
    static LocalDate convertDate(EnforcementDateType type, LocalDate publicationDate) {
        Objects.requireNonNull(publicationDate, "Publication date is required");
        if (type instanceof EnforcementDateType.Date date) {
            return date.date();
        }
        if (type instanceof EnforcementDateType.DaysAfterPublication days) {
            return publicationDate.plusDays(days.days());
        }
        if (type instanceof EnforcementDateType.DayInMonthAfterPublication dayInMonth) {
            LocalDate month = publicationDate.plusMonths(dayInMonth.monthOrDefault());
            if (dayInMonth.day() > month.lengthOfMonth()) {
                throw new EnforcementDateException("Day " + dayInMonth.day() + " does not exist in " + month.getMonth());
            }
            return month.withDayOfMonth(dayInMonth.day());
        }
        throw new EnforcementDateException("Unsupported enforcement date kind: " + type);
    }

    private static Reference structuralToArticleRange(StructuralReference structural, Act act) {
        CutPoints cut;
        try {
            cut = CutPointResolver.resolve(act, structural, false);
        } catch (ReferenceResolutionException e) {
            throw new EnforcementDateException("Could not resolve enforcement date position " + structural, e);
        }
        List<Article> articles = new ArrayList<>();
        for (ActChild child : act.children().subList(cut.start(), cut.end())) {
            if (child instanceof Article article) {
                articles.add(article);
            }
        }
        if (articles.isEmpty()) {
            throw new EnforcementDateException("Enforcement date structural position contained no articles: "
                    + structural);
        }
        IdentifierRange range = new IdentifierRange(
                articles.get(0).identifier(), articles.get(articles.size() - 1).identifier());
        return Reference.empty().withPart(ReferenceLevel.ARTICLE, range);
    }
}

package com.williamcallahan.actdb.enforcement;

import static com.williamcallahan.actdb.TestActs.article;
import static com.williamcallahan.actdb.TestActs.defaultEnforcement;
import static com.williamcallahan.actdb.TestActs.part;
import static com.williamcallahan.actdb.TestActs.text;
import static com.williamcallahan.actdb.TestActs.withPhrase;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.semantic.EnforcementDateType;
import com.williamcallahan.actdb.domain.semantic.SpecialPhrase;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.SaeKind;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Verifies enforcement date collection and lookups in {@link EnforcementDateResolver}.
 */
class EnforcementDateResolverTest {

    private static final ActIdentifier ID = new ActIdentifier(2013, 100);
    private static final LocalDate PUBLISHED = LocalDate.of(2013, 7, 1);
    private static final LocalDate DEFAULT_DATE = LocalDate.of(2013, 7, 2);
    private static final LocalDate LATE_DATE = LocalDate.of(2013, 9, 1);

    private static Act actWith(SpecialPhrase.EnforcementDate... phrases) {
        List<ActChild> children = new ArrayList<>();
        children.add(article("1", null, text(SaeKind.PARAGRAPH, "1", "First rule.")));
        children.add(article("2", null,
                text(SaeKind.PARAGRAPH, "1", "Second rule."),
                text(SaeKind.PARAGRAPH, "2", "Third rule.")));
        List<SubArticleElement> paragraphs = new ArrayList<>();
        for (int i = 0; i < phrases.length; i++) {
            paragraphs.add(withPhrase(text(SaeKind.PARAGRAPH, String.valueOf(i + 1), "Entry into force."),
                    phrases[i]));
        }
        children.add(article("3", null,
                paragraphs.toArray(new SubArticleElement[0])));
        return new Act(ID, "Dates", "", PUBLISHED, children);
    }

    private static SpecialPhrase.EnforcementDate override(Reference position, LocalDate date) {
        return new SpecialPhrase.EnforcementDate(List.of(position), List.of(),
                new EnforcementDateType.Date(date), null);
    }

    private static EnforcementDateResolver standardResolver() {
        return EnforcementDateResolver.fromAct(actWith(
                defaultEnforcement(new EnforcementDateType.DaysAfterPublication(1)),
                override(Reference.toArticle("2"), LATE_DATE)), List.of());
    }

    @Test
    void effectiveDate_usesOverrideForGovernedPositions() {
        EnforcementDateResolver resolver = standardResolver();

        assertEquals(DEFAULT_DATE, resolver.effectiveDate(Reference.toArticle("1")));
        assertEquals(LATE_DATE, resolver.effectiveDate(Reference.toArticle("2").withParagraph("1")));
        assertEquals(LATE_DATE, resolver.effectiveDate(Reference.toAct(ID).withArticle("2")));
    }

    @Test
    void cameIntoForce_comparesAgainstEffectiveDate() {
        EnforcementDateResolver resolver = standardResolver();
        Reference first = Reference.toArticle("1");

        assertTrue(resolver.cameIntoForceToday(first, DEFAULT_DATE));
        assertFalse(resolver.cameIntoForceToday(first, PUBLISHED));
        assertTrue(resolver.cameIntoForceYesterday(first, DEFAULT_DATE.plusDays(1)));
        assertTrue(resolver.isInForce(first, DEFAULT_DATE.plusDays(10)));
        assertFalse(resolver.isInForce(Reference.toArticle("2"), DEFAULT_DATE.plusDays(10)));
    }

    @Test
    void allDates_listsOverridesBeforeDefault() {
        assertEquals(List.of(LATE_DATE, DEFAULT_DATE), standardResolver().allDates());
    }

    @Test
    void specificElementNotInForce_onlyMatchesTheGovernedLevel() {
        EnforcementDateResolver resolver = standardResolver();
        LocalDate between = LocalDate.of(2013, 8, 1);

        assertEquals(Optional.of(LATE_DATE), resolver.specificElementNotInForce(Reference.toArticle("2"), between));
        assertTrue(resolver.specificElementNotInForce(Reference.toArticle("2").withParagraph("1"), between).isEmpty());
        assertTrue(resolver.specificElementNotInForce(Reference.toArticle("2"), LATE_DATE).isEmpty());
    }

    @Test
    void fromAct_appendsAdditionalDates() {
        Act withoutDates = actWith();
        EnforcementDateResolver resolver = EnforcementDateResolver.fromAct(withoutDates,
                List.of(defaultEnforcement(new EnforcementDateType.Date(DEFAULT_DATE))));

        assertEquals(DEFAULT_DATE, resolver.defaultDate());
    }

    @Test
    void fromAct_resolvesStructuralPositionsToArticleRanges() {
        Act act = new Act(ID, "Dates", "", PUBLISHED, List.of(
                part("1", "Immediate"),
                article("1", null, withPhrase(text(SaeKind.PARAGRAPH, "1", "Default."),
                        defaultEnforcement(new EnforcementDateType.DaysAfterPublication(0)))),
                part("2", "Later"),
                article("2", null, text(SaeKind.PARAGRAPH, "1", "Later rule.")),
                article("3", null, withPhrase(text(SaeKind.PARAGRAPH, "1", "Later default."),
                        new SpecialPhrase.EnforcementDate(List.of(),
                                List.of(StructuralReference.of(StructuralReferenceElement.part("2"))),
                                new EnforcementDateType.Date(LATE_DATE), null)))));

        EnforcementDateResolver resolver = EnforcementDateResolver.fromAct(act, List.of());

        assertEquals(PUBLISHED, resolver.effectiveDate(Reference.toArticle("1")));
        assertEquals(LATE_DATE, resolver.effectiveDate(Reference.toArticle("3")));
    }

    @Test
    void fromAct_rejectsInconsistentDates() {
        SpecialPhrase.EnforcementDate first = defaultEnforcement(new EnforcementDateType.DaysAfterPublication(1));
        SpecialPhrase.EnforcementDate second = defaultEnforcement(new EnforcementDateType.DaysAfterPublication(5));

        assertThrows(EnforcementDateException.class,
                () -> EnforcementDateResolver.fromAct(actWith(first, second), List.of()));
        assertThrows(EnforcementDateException.class,
                () -> EnforcementDateResolver.fromAct(actWith(override(Reference.toArticle("1"), LATE_DATE)),
                        List.of()));
        assertThrows(EnforcementDateException.class,
                () -> EnforcementDateResolver.fromAct(actWith(first, override(Reference.toArticle("1"), PUBLISHED)),
                        List.of()));
        assertThrows(EnforcementDateException.class,
                () -> EnforcementDateResolver.fromAct(actWith(first,
                        override(Reference.toAct(ID).withArticle("1"), LATE_DATE)), List.of()));
    }

    @Test
    void convertDate_handlesRelativeDates() {
        assertEquals(LocalDate.of(2013, 7, 31),
                EnforcementDateResolver.convertDate(new EnforcementDateType.DaysAfterPublication(30), PUBLISHED));
        assertEquals(LocalDate.of(2013, 8, 15), EnforcementDateResolver.convertDate(
                new EnforcementDateType.DayInMonthAfterPublication(null, 15), PUBLISHED));
        assertEquals(LocalDate.of(2013, 10, 1), EnforcementDateResolver.convertDate(
                new EnforcementDateType.DayInMonthAfterPublication(3, 1), PUBLISHED));
    }

    @Test
    void convertDate_rejectsImpossibleAndSpecialDates() {
        assertThrows(EnforcementDateException.class, () -> EnforcementDateResolver.convertDate(
                new EnforcementDateType.DayInMonthAfterPublication(2, 31), PUBLISHED));
        assertThrows(EnforcementDateException.class, () -> EnforcementDateResolver.convertDate(
                new EnforcementDateType.Special("when the minister says so"), PUBLISHED));
    }
}

package com.williamcallahan.actdb.parser;

import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.structure.Act;

/**
 * Recomputes parser-derived annotations after an act's text changed.
 *
 * <p>The legal-text parser is an external collaborator. Amendment appliers call it through this
 * seam so a real parser can be plugged in without touching the amendment engine.</p>
 */
public interface SemanticInfoProvider {

    /**
     * Recomputes the semantic info of one article.
     *
     * @param act act containing the article
     * @param article identifier of the changed article
     * @return the updated act and whether abbreviations defined by the article changed
     */
    ArticleUpdate addSemanticInfoToArticle(Act act, Identifier article);

    /**
     * Recomputes the semantic info of the whole act.
     *
     * @param act act to analyse
     * @return updated act
     */
    Act addSemanticInfo(Act act);

    /**
     * Parses quoted text of block-amendment paragraphs into structured block-amendment content.
     *
     * @param act act to analyse
     * @return updated act
     */
    Act convertBlockAmendments(Act act);

    /**
     * Result of a single-article recomputation.
     *
     * @param act updated act
     * @param abbreviationsChanged whether the article defined or redefined abbreviations, which
     *                             invalidates the semantic info of the whole act
     */
    record ArticleUpdate(Act act, boolean abbreviationsChanged) {
    }
}

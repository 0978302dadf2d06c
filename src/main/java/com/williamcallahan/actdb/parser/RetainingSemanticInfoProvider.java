package com.williamcallahan.actdb.parser;

import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.structure.Act;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the semantic info that came with the stored act. Used when no parser is available:
 * amended text keeps the annotations of the text it replaced, quoted content keeps the structure it
 * was stored with.
 */
@Component
public class RetainingSemanticInfoProvider implements SemanticInfoProvider {
    private static final Logger log = LoggerFactory.getLogger(RetainingSemanticInfoProvider.class);

    @Override
    public ArticleUpdate addSemanticInfoToArticle(Act act, Identifier article) {
        log.debug("Keeping semantic info of article {} in {}", article, act.identifier());
        return new ArticleUpdate(act, false);
    }

    @Override
    public Act addSemanticInfo(Act act) {
        log.debug("Keeping semantic info of {}", act.identifier());
        return act;
    }

    @Override
    public Act convertBlockAmendments(Act act) {
        return act;
    }
}

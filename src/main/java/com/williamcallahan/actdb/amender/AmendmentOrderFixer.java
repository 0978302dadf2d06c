package com.williamcallahan.actdb.amender;

import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.ReferenceLevel;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;

import java.util.Collections;
import java.util.List;

/**
 * Reorders the modifications of one act and date so that applying them one by one does not
 * invalidate a later one.
 *
 * <p>Known limitation: only the pairs below are recognised, this is not a total order.</p>
 * <ul>
 *   <li>Two text amendments of overlapping elements, where the later one's text contains the earlier
 *       one's text ("aaa" then "aaa xxx"), or the earlier one's replacement contains the later one's
 *       text ("a" to "b c d" then "c" to "x").</li>
 *   <li>Two block amendments, where the later one replaces a parent of the earlier one.</li>
 *   <li>A block amendment followed by a structural amendment of the article containing it.</li>
 * </ul>
 */
public final class AmendmentOrderFixer {

    private AmendmentOrderFixer() {
        // Utility class - no instantiation
    }

    /**
     * Fixes the order in place. For each index, the element there is compared with every later
     * element and swapped with it whenever the pair is in the wrong order.
     *
     * @param modifications modifications of one act, in extraction order
     */
    public static void fixOrder(List<AppliableModification> modifications) {
        for (int earlier = 0; earlier < modifications.size(); earlier++) {
            for (int later = earlier + 1; later < modifications.size(); later++) {
                if (isOrderWrong(modifications.get(earlier).modification(), modifications.get(later).modification())) {
                    Collections.swap(modifications, earlier, later);
                }
            }
        }
    }

    static boolean isOrderWrong(Modification earlier, Modification later) {
        if (earlier instanceof Modification.TextAmendment earlierText
                && later instanceof Modification.TextAmendment laterText
                && earlierText.reference() instanceof TextAmendmentReference.Sae earlierSae
                && laterText.reference() instanceof TextAmendmentReference.Sae laterSae) {
            Reference earlierRef = earlierSae.reference();
            Reference laterRef = laterSae.reference();
            if (!earlierRef.contains(laterRef) && !laterRef.contains(earlierRef)) {
                return false;
            }
            return laterText.from().contains(earlierText.from()) || earlierText.to().contains(laterText.from());
        }
        if (earlier instanceof Modification.BlockAmendment earlierBlock) {
            if (later instanceof Modification.BlockAmendment laterBlock) {
                return laterBlock.position().contains(earlierBlock.position());
            }
            if (later instanceof Modification.StructuralBlockAmendment laterStructural) {
                return articleContains(laterStructural.position(), earlierBlock.position());
            }
        }
        return false;
    }

    private static boolean articleContains(StructuralReference structural, Reference position) {
        if (structural.act() == null || structural.element().kind() != StructuralReferenceElement.Kind.ARTICLE) {
            return false;
        }
        Reference articleRef = Reference.toAct(structural.act())
                .withPart(ReferenceLevel.ARTICLE, structural.element().ids());
        return articleRef.contains(position);
    }
}

package com.williamcallahan.actdb.amender;

import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.structure.ChangeCause;

import java.util.Objects;

/**
 * Modification together with the reason it is applied.
 *
 * @param cause amending provision or opaque label, recorded in the change stamps
 * @param modification the change itself
 */
public record AppliableModification(ChangeCause cause, Modification modification) {

    public AppliableModification {
        Objects.requireNonNull(cause, "Change cause is required");
        Objects.requireNonNull(modification, "Modification is required");
    }

    public ActIdentifier affectedAct() {
        return modification.affectedAct();
    }
}

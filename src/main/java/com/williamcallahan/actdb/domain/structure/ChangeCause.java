package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.williamcallahan.actdb.domain.reference.Reference;

import java.util.Objects;

/**
 * Reason for a modification: the amending provision of another act, or an opaque label.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ChangeCause.Amendment.class, name = "Amendment"),
    @JsonSubTypes.Type(value = ChangeCause.Other.class, name = "Other")
})
public sealed interface ChangeCause permits ChangeCause.Amendment, ChangeCause.Other {

    /** Cause used for the statutory repeal of amending provisions the day after they took effect. */
    Other AUTO_REPEAL = new Other("AutoRepeal");

    /**
     * Modification requested by a provision of an act.
     *
     * @param reference absolute position of the amending provision
     */
    record Amendment(Reference reference) implements ChangeCause {
        public Amendment {
            Objects.requireNonNull(reference, "Amending reference is required");
        }
    }

    /**
     * Modification with a non-provision origin, such as the auto-repeal rule or a manual fixup.
     *
     * @param label human readable label
     */
    record Other(String label) implements ChangeCause {
        public Other {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("Change cause label is required");
            }
        }
    }
}

package com.project.lingodeck.backend.algorithm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type-specific payload of a {@link FlashCard}.
 *
 * Scheduling never looks inside the content, it is stored and returned as-is.
 * The {@code kind} property tags the variant when the content is serialized,
 * so a stored card can be read back without knowing its {@link CardType} first.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = VocabularyContent.class, name = "vocabulary"),
        @JsonSubTypes.Type(value = GrammarFormContent.class, name = "grammar_form"),
        @JsonSubTypes.Type(value = SentenceContent.class, name = "sentence")
})
public interface CardContent {

    /** The card type this payload belongs to. */
    @JsonIgnore
    CardType getCardType();
}

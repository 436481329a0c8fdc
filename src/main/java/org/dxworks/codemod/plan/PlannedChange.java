package org.dxworks.codemod.plan;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.dxworks.codemod.ComponentModifier;

/**
 * One entry of a plan document's {@code changes} array, selected by its {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = AddImportChange.class, name = "ADD_IMPORT"),
        @JsonSubTypes.Type(value = AddStateChange.class, name = "ADD_STATE"),
        @JsonSubTypes.Type(value = AddEffectChange.class, name = "ADD_EFFECT"),
        @JsonSubTypes.Type(value = AddHookChange.class, names = {"ADD_REF", "ADD_MEMO", "ADD_CALLBACK"}),
        @JsonSubTypes.Type(value = AddReducerChange.class, name = "ADD_REDUCER"),
        @JsonSubTypes.Type(value = AddFunctionChange.class, name = "ADD_FUNCTION"),
        @JsonSubTypes.Type(value = ReplaceFunctionBodyChange.class, name = "REPLACE_FUNCTION_BODY"),
        @JsonSubTypes.Type(value = ConditionalRenderChange.class, name = "CONDITIONAL_RENDER"),
        @JsonSubTypes.Type(value = WrapElementChange.class, name = "WRAP_ELEMENT"),
        @JsonSubTypes.Type(value = InsertMarkupChange.class, name = "INSERT_MARKUP"),
        @JsonSubTypes.Type(value = DeleteElementChange.class, name = "DELETE_ELEMENT"),
        @JsonSubTypes.Type(value = ModifyPropChange.class, name = "MODIFY_PROP"),
        @JsonSubTypes.Type(value = ModifyClassNameChange.class, name = "MODIFY_CLASS_NAME"),
        @JsonSubTypes.Type(value = ReplaceChange.class, name = "REPLACE"),
        @JsonSubTypes.Type(value = TextPatchChange.class, names = {"INSERT_AFTER", "INSERT_BEFORE", "DELETE", "APPEND"})
})
public abstract class PlannedChange {
    public String type;

    /**
     * Queues this change on {@code modifier}.
     *
     * @throws IllegalArgumentException when the change is missing required fields
     */
    public abstract void applyTo(ComponentModifier modifier);

    protected static String require(String value, String field, String type) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(type + " requires " + field);
        }
        return value;
    }
}

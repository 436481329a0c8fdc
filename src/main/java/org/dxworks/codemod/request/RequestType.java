package org.dxworks.codemod.request;

public enum RequestType {
    ADD_IMPORT,
    ADD_STATE_VARIABLE,
    ADD_USE_EFFECT,
    ADD_HOOK_VARIABLE,
    ADD_REDUCER,
    ADD_FUNCTION,
    REPLACE_FUNCTION_BODY,
    ADD_CONDITIONAL_RENDER,
    WRAP_ELEMENT,
    INSERT_MARKUP,
    DELETE_ELEMENT,
    MODIFY_PROP,
    MODIFY_CLASS_NAME,
    REPLACE_TEXT,
    PATCH_TEXT
}

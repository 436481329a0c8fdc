package org.dxworks.codemod.request;

import static org.dxworks.codemod.query.TreeHelper.isValidIdentifier;

/**
 * Replaces everything between the braces of the named function's block body.
 */
public class ReplaceFunctionBody implements ModificationRequest {
    private final String functionName;
    private final String body;

    public ReplaceFunctionBody(String functionName, String body) {
        if (!isValidIdentifier(functionName)) {
            throw new IllegalArgumentException("Invalid function name: " + functionName);
        }
        this.functionName = functionName;
        this.body = body == null ? "" : body;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getBody() {
        return body;
    }

    @Override
    public RequestType getType() {
        return RequestType.REPLACE_FUNCTION_BODY;
    }

    @Override
    public String describe() {
        return "replace body of function '" + functionName + "'";
    }
}

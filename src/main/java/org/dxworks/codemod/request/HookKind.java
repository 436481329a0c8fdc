package org.dxworks.codemod.request;

public enum HookKind {
    REF("useRef"),
    MEMO("useMemo"),
    CALLBACK("useCallback");

    private final String hookName;

    HookKind(String hookName) {
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }
}

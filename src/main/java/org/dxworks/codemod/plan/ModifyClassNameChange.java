package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.ClassNameSpec;

import java.util.ArrayList;
import java.util.List;

public class ModifyClassNameChange extends ElementChange {
    public List<String> addClasses = new ArrayList<>();
    public List<String> removeClasses = new ArrayList<>();
    public String condition;
    public String whenTrue;
    public String whenFalse;

    @Override
    public void applyTo(ComponentModifier modifier) {
        modifier.modifyClassName(target(), new ClassNameSpec(addClasses, removeClasses, condition, whenTrue, whenFalse));
    }
}

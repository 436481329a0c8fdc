package org.dxworks.codemod.query;

import org.dxworks.codemod.parser.SyntaxNode;

/**
 * An existing {@code const [value, setValue] = useState(initial)} declaration.
 */
public class StateVariable {
    public final String name;
    public final String setter;
    public final String initialValue;
    public final SyntaxNode declaration;

    public StateVariable(String name, String setter, String initialValue, SyntaxNode declaration) {
        this.name = name;
        this.setter = setter;
        this.initialValue = initialValue;
        this.declaration = declaration;
    }
}

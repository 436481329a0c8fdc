package org.dxworks.codemod.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.WrapperSpec;

import java.util.LinkedHashMap;
import java.util.Map;

public class WrapElementChange extends ElementChange {
    public String wrapperComponent;
    public Map<String, String> wrapperProps = new LinkedHashMap<>();
    @JsonProperty("import")
    public ImportDescriptor importDescriptor;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(wrapperComponent, "wrapperComponent", type);
        WrapperSpec wrapper = new WrapperSpec(wrapperComponent, wrapperProps,
                importDescriptor != null ? importDescriptor.toSpec() : null);
        modifier.wrapElement(target(), wrapper);
    }
}

package org.dxworks.codemod.plan;

import java.util.ArrayList;
import java.util.List;

public class ModificationPlan {
    public List<PlannedChange> changes = new ArrayList<>();
}

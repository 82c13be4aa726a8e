/**
 * ChildrenContainer.java
 */
package club.ppmc.ideabridge.host.debug;

import club.ppmc.ideabridge.model.debug.VariableInfo;
import java.util.List;

public interface ChildrenContainer {

    void addChildren(List<VariableInfo> children, boolean last);

    void errorOccurred(String message);
}

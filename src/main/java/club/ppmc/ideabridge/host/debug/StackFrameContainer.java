/**
 * StackFrameContainer.java
 */
package club.ppmc.ideabridge.host.debug;

import club.ppmc.ideabridge.model.debug.StackFrameInfo;
import java.util.List;

public interface StackFrameContainer {

    void addStackFrames(List<StackFrameInfo> frames, boolean last);

    void errorOccurred(String message);
}

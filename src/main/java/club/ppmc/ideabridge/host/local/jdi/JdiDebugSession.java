/**
 * JdiDebugSession.java
 *
 * 基于 Java Debug Interface 的调试会话，连接到一个以 JDWP 监听的虚拟机。
 * 事件线程处理断点、单步、类加载和虚拟机退出事件；命中断点或单步结束时记录挂起的线程，
 * 之后的栈、变量和求值都针对这个线程进行。
 */
package club.ppmc.ideabridge.host.local.jdi;

import club.ppmc.ideabridge.host.debug.ChildrenContainer;
import club.ppmc.ideabridge.host.debug.DebugSession;
import club.ppmc.ideabridge.host.debug.ExpressionEvaluator;
import club.ppmc.ideabridge.host.debug.StackFrameContainer;
import club.ppmc.ideabridge.model.debug.BreakpointInfo;
import club.ppmc.ideabridge.model.debug.StackFrameInfo;
import club.ppmc.ideabridge.model.debug.VariableInfo;
import com.sun.jdi.AbsentInformationException;
import com.sun.jdi.IncompatibleThreadStateException;
import com.sun.jdi.LocalVariable;
import com.sun.jdi.Location;
import com.sun.jdi.ObjectReference;
import com.sun.jdi.ReferenceType;
import com.sun.jdi.StackFrame;
import com.sun.jdi.ThreadReference;
import com.sun.jdi.VMDisconnectedException;
import com.sun.jdi.VirtualMachine;
import com.sun.jdi.event.BreakpointEvent;
import com.sun.jdi.event.ClassPrepareEvent;
import com.sun.jdi.event.Event;
import com.sun.jdi.event.EventQueue;
import com.sun.jdi.event.EventSet;
import com.sun.jdi.event.LocatableEvent;
import com.sun.jdi.event.StepEvent;
import com.sun.jdi.event.VMDeathEvent;
import com.sun.jdi.event.VMDisconnectEvent;
import com.sun.jdi.request.BreakpointRequest;
import com.sun.jdi.request.ClassPrepareRequest;
import com.sun.jdi.request.EventRequest;
import com.sun.jdi.request.EventRequestManager;
import com.sun.jdi.request.StepRequest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JdiDebugSession implements DebugSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdiDebugSession.class);

    private final String name;
    private final VirtualMachine vm;
    private final Supplier<List<BreakpointInfo>> breakpoints;

    private volatile ThreadReference suspendedThread;
    private volatile boolean terminated;
    private volatile Thread eventThread;

    JdiDebugSession(String name, VirtualMachine vm, Supplier<List<BreakpointInfo>> breakpoints) {
        this.name = name;
        this.vm = vm;
        this.breakpoints = breakpoints;
    }

    /**
     * 为已知断点注册类加载监听、应用到已加载的类上，然后启动事件线程并让虚拟机继续运行。
     */
    void start() {
        for (BreakpointInfo breakpoint : breakpoints.get()) {
            watchClass(breakpoint.className());
            applyBreakpoint(breakpoint, true);
        }
        configureAndStartEventHandling();
        vm.resume();
        LOGGER.info("调试会话 '{}' 已附加到 {}，虚拟机继续运行。", name, vm.description());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isSuspended() {
        return !terminated && suspendedThread != null;
    }

    public boolean isTerminated() {
        return terminated;
    }

    @Override
    public void pause() {
        vm.suspend();
        suspendedThread = pickThreadToInspect();
        LOGGER.info("调试会话 '{}' 已暂停，检查线程: {}", name,
                suspendedThread != null ? suspendedThread.name() : "无");
    }

    private ThreadReference pickThreadToInspect() {
        List<ThreadReference> candidates = new ArrayList<>();
        for (ThreadReference thread : vm.allThreads()) {
            try {
                if (thread.frameCount() > 0) {
                    candidates.add(thread);
                }
            } catch (IncompatibleThreadStateException e) {
                LOGGER.debug("线程 {} 状态不兼容，跳过。", thread.name());
            }
        }
        return candidates.stream()
                .filter(thread -> "main".equals(thread.name()))
                .findFirst()
                .orElse(candidates.isEmpty() ? null : candidates.get(0));
    }

    @Override
    public void resume() {
        suspendedThread = null;
        vm.resume();
    }

    @Override
    public void stepOver() {
        executeStep(StepRequest.STEP_OVER);
    }

    @Override
    public void stepInto() {
        executeStep(StepRequest.STEP_INTO);
    }

    @Override
    public void stepOut() {
        executeStep(StepRequest.STEP_OUT);
    }

    private void executeStep(int stepType) {
        ThreadReference thread = suspendedThread;
        if (thread == null) {
            throw new IllegalStateException("没有已暂停的线程，无法单步执行。");
        }
        EventRequestManager manager = vm.eventRequestManager();
        manager.deleteEventRequests(manager.stepRequests());
        StepRequest request = manager.createStepRequest(thread, StepRequest.STEP_LINE, stepType);
        request.addCountFilter(1);
        request.setSuspendPolicy(EventRequest.SUSPEND_ALL);
        request.enable();
        suspendedThread = null;
        vm.resume();
    }

    @Override
    public void computeStackFrames(StackFrameContainer container) {
        ThreadReference thread = suspendedThread;
        if (thread == null) {
            container.errorOccurred("会话未处于暂停状态。");
            return;
        }
        try {
            var frames = new ArrayList<StackFrameInfo>();
            int index = 0;
            for (StackFrame frame : thread.frames()) {
                Location loc = frame.location();
                frames.add(new StackFrameInfo(index++, loc.declaringType().name(), loc.method().name(),
                        sourceName(loc), loc.lineNumber()));
            }
            container.addStackFrames(frames, true);
        } catch (IncompatibleThreadStateException e) {
            container.errorOccurred("线程 " + thread.name() + " 未处于挂起状态。");
        } catch (VMDisconnectedException e) {
            container.errorOccurred("虚拟机已断开连接。");
        }
    }

    private static String sourceName(Location loc) {
        try {
            return loc.sourceName();
        } catch (AbsentInformationException e) {
            return "Unknown Source";
        }
    }

    @Override
    public void computeChildren(int frameIndex, ChildrenContainer container) {
        ThreadReference thread = suspendedThread;
        if (thread == null) {
            container.errorOccurred("会话未处于暂停状态。");
            return;
        }
        try {
            StackFrame frame = thread.frame(frameIndex);
            var variables = new ArrayList<VariableInfo>();
            ObjectReference self = frame.thisObject();
            if (self != null) {
                variables.add(JdiValues.describe("this", self));
            }
            for (LocalVariable variable : frame.visibleVariables()) {
                variables.add(new VariableInfo(
                        variable.name(), variable.typeName(), JdiValues.valueToString(frame.getValue(variable))));
            }
            container.addChildren(variables, true);
        } catch (IncompatibleThreadStateException e) {
            container.errorOccurred("线程 " + thread.name() + " 未处于挂起状态。");
        } catch (AbsentInformationException e) {
            container.errorOccurred("当前类缺少调试信息，请确认编译时包含了局部变量表 (-g)。");
        } catch (IndexOutOfBoundsException e) {
            container.errorOccurred("栈帧 " + frameIndex + " 不存在。");
        } catch (VMDisconnectedException e) {
            container.errorOccurred("虚拟机已断开连接。");
        }
    }

    @Override
    public Optional<ExpressionEvaluator> evaluator() {
        ThreadReference thread = suspendedThread;
        return thread == null || terminated ? Optional.empty() : Optional.of(new JdiExpressionEvaluator(thread));
    }

    void applyBreakpoint(BreakpointInfo breakpoint, boolean enabled) {
        if (terminated) {
            return;
        }
        for (ReferenceType refType : vm.classesByName(breakpoint.className())) {
            applyBreakpoint(refType, breakpoint.line(), enabled);
        }
    }

    private void applyBreakpoint(ReferenceType refType, int line, boolean enabled) {
        try {
            List<Location> locations = refType.locationsOfLine(line);
            if (locations.isEmpty()) {
                LOGGER.warn("在类 {} 的行 {} 找不到可执行代码位置，无法应用断点。", refType.name(), line);
                return;
            }
            Location loc = locations.get(0);
            EventRequestManager manager = vm.eventRequestManager();
            manager.breakpointRequests().stream()
                    .filter(req -> req.location().equals(loc))
                    .toList()
                    .forEach(manager::deleteEventRequest);
            if (enabled) {
                BreakpointRequest request = manager.createBreakpointRequest(loc);
                request.setSuspendPolicy(EventRequest.SUSPEND_ALL);
                request.enable();
                LOGGER.info("已在 {} 应用断点。", loc);
            }
        } catch (AbsentInformationException e) {
            LOGGER.warn("无法在 {}:{} 设置断点，类缺少行号信息。", refType.name(), line);
        }
    }

    void watchClass(String className) {
        if (terminated) {
            return;
        }
        ClassPrepareRequest request = vm.eventRequestManager().createClassPrepareRequest();
        request.addClassFilter(className);
        request.setSuspendPolicy(EventRequest.SUSPEND_ALL);
        request.enable();
    }

    private void configureAndStartEventHandling() {
        eventThread = new Thread(() -> {
            try {
                EventQueue eventQueue = vm.eventQueue();
                while (!Thread.currentThread().isInterrupted()) {
                    EventSet eventSet = eventQueue.remove();
                    boolean stayPaused = false;
                    for (Event event : eventSet) {
                        if (handleEvent(event)) {
                            stayPaused = true;
                        }
                    }
                    if (!stayPaused) {
                        eventSet.resume();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (VMDisconnectedException e) {
                LOGGER.info("调试会话 '{}' 的虚拟机已断开连接。", name);
            } finally {
                terminated = true;
                suspendedThread = null;
            }
        }, "JDI-Event-Handler-" + name);
        eventThread.setDaemon(true);
        eventThread.start();
    }

    /**
     * @return true 表示虚拟机应保持暂停。
     */
    private boolean handleEvent(Event event) {
        if (event instanceof VMDisconnectEvent || event instanceof VMDeathEvent) {
            LOGGER.info("调试会话 '{}' 检测到虚拟机退出。", name);
            terminated = true;
            suspendedThread = null;
        } else if (event instanceof BreakpointEvent || event instanceof StepEvent) {
            LocatableEvent located = (LocatableEvent) event;
            suspendedThread = located.thread();
            LOGGER.info("调试会话 '{}' 暂停于 {}", name, located.location());
            return true;
        } else if (event instanceof ClassPrepareEvent prepared) {
            ReferenceType refType = prepared.referenceType();
            breakpoints.get().stream()
                    .filter(bp -> bp.className().equals(refType.name()))
                    .sorted(Comparator.comparingInt(BreakpointInfo::line))
                    .forEach(bp -> applyBreakpoint(refType, bp.line(), true));
        }
        return false;
    }

    /**
     * 断开与虚拟机的连接并终止事件线程。被调试进程本身由运行注册表负责终止。
     */
    void dispose() {
        Thread thread = eventThread;
        if (thread != null && thread.isAlive()) {
            thread.interrupt();
        }
        if (!terminated) {
            terminated = true;
            suspendedThread = null;
            try {
                vm.eventRequestManager().deleteAllBreakpoints();
                vm.dispose();
                LOGGER.info("调试会话 '{}' 的 VM 连接已释放。", name);
            } catch (VMDisconnectedException e) {
                LOGGER.info("调试会话 '{}' 的 VM 在清理时已断开连接。", name);
            }
        }
    }
}

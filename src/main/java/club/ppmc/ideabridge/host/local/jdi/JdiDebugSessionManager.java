/**
 * JdiDebugSessionManager.java
 *
 * 管理 JDI 调试会话与用户断点。断点按“文件 + 行号”保存，跨会话保留，
 * 设置或移除时同步应用到所有存活的会话上。
 */
package club.ppmc.ideabridge.host.local.jdi;

import club.ppmc.ideabridge.host.debug.DebugSession;
import club.ppmc.ideabridge.host.debug.DebugSessionManager;
import club.ppmc.ideabridge.model.debug.BreakpointInfo;
import com.sun.jdi.Bootstrap;
import com.sun.jdi.VirtualMachine;
import com.sun.jdi.VirtualMachineManager;
import com.sun.jdi.connect.AttachingConnector;
import com.sun.jdi.connect.Connector;
import com.sun.jdi.connect.IllegalConnectorArgumentsException;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JdiDebugSessionManager implements DebugSessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdiDebugSessionManager.class);
    private static final String ATTACH_TIMEOUT_MS = "10000";

    private final List<JdiDebugSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicReference<JdiDebugSession> current = new AtomicReference<>();
    private final Map<String, Set<Integer>> userBreakpoints = new ConcurrentHashMap<>();

    @Override
    public List<DebugSession> sessions() {
        sessions.removeIf(JdiDebugSession::isTerminated);
        return List.copyOf(sessions);
    }

    @Override
    public Optional<DebugSession> currentSession() {
        JdiDebugSession session = current.get();
        if (session != null && session.isTerminated()) {
            current.compareAndSet(session, null);
            return Optional.empty();
        }
        return Optional.ofNullable(session);
    }

    @Override
    public DebugSession attach(String name, int port) throws IOException {
        VirtualMachine vm = attachToVm(port);
        LOGGER.info("已成功附加到 VM: {}", vm.description());
        var session = new JdiDebugSession(name, vm, this::breakpoints);
        session.start();
        sessions.add(session);
        current.set(session);
        return session;
    }

    private VirtualMachine attachToVm(int port) throws IOException {
        VirtualMachineManager vmm = Bootstrap.virtualMachineManager();
        AttachingConnector connector = vmm.attachingConnectors().stream()
                .filter(c -> "dt_socket".equals(c.transport().name()))
                .findFirst()
                .orElseThrow(() -> new IOException("找不到 dt_socket attaching connector"));

        Map<String, Connector.Argument> arguments = connector.defaultArguments();
        arguments.get("port").setValue(String.valueOf(port));
        arguments.get("hostname").setValue("localhost");
        arguments.get("timeout").setValue(ATTACH_TIMEOUT_MS);
        try {
            return connector.attach(arguments);
        } catch (IllegalConnectorArgumentsException e) {
            throw new IOException("JDWP 连接参数无效: " + e.getMessage(), e);
        }
    }

    @Override
    public void detachCurrent() {
        JdiDebugSession session = current.getAndSet(null);
        if (session != null) {
            session.dispose();
            sessions.remove(session);
        }
    }

    @Override
    public List<BreakpointInfo> breakpoints() {
        var result = new ArrayList<BreakpointInfo>();
        userBreakpoints.forEach((file, lines) ->
                lines.forEach(line -> result.add(new BreakpointInfo(file, line, guessClassNameFromFilePath(file)))));
        result.sort(Comparator.comparing(BreakpointInfo::file).thenComparingInt(BreakpointInfo::line));
        return result;
    }

    @Override
    public boolean setBreakpoint(String file, int line) {
        String normalized = normalize(file);
        boolean added = userBreakpoints.computeIfAbsent(normalized, k -> new ConcurrentSkipListSet<>()).add(line);
        if (added) {
            var breakpoint = new BreakpointInfo(normalized, line, guessClassNameFromFilePath(normalized));
            for (JdiDebugSession session : sessions) {
                session.watchClass(breakpoint.className());
                session.applyBreakpoint(breakpoint, true);
            }
        }
        return added;
    }

    @Override
    public boolean removeBreakpoint(String file, int line) {
        String normalized = normalize(file);
        Set<Integer> lines = userBreakpoints.get(normalized);
        boolean removed = lines != null && lines.remove(line);
        if (removed) {
            var breakpoint = new BreakpointInfo(normalized, line, guessClassNameFromFilePath(normalized));
            sessions.forEach(session -> session.applyBreakpoint(breakpoint, false));
        }
        return removed;
    }

    private static String normalize(String file) {
        return file.trim().replace("\\", "/");
    }

    static String guessClassNameFromFilePath(String filePath) {
        String path = normalize(filePath);
        for (String root : List.of("src/main/java/", "src/test/java/")) {
            int index = path.indexOf(root);
            if (index >= 0) {
                path = path.substring(index + root.length());
                break;
            }
        }
        String pathWithoutExt = path.endsWith(".java") ? path.substring(0, path.length() - 5) : path;
        return pathWithoutExt.replace("/", ".");
    }

    @PreDestroy
    public void shutdown() {
        sessions.forEach(JdiDebugSession::dispose);
        sessions.clear();
        current.set(null);
    }
}

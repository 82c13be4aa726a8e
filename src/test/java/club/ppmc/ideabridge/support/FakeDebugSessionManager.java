package club.ppmc.ideabridge.support;

import club.ppmc.ideabridge.host.debug.DebugSession;
import club.ppmc.ideabridge.host.debug.DebugSessionManager;
import club.ppmc.ideabridge.model.debug.BreakpointInfo;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

public class FakeDebugSessionManager implements DebugSessionManager {

    private final List<DebugSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicReference<DebugSession> current = new AtomicReference<>();
    private final List<BreakpointInfo> breakpoints = new CopyOnWriteArrayList<>();
    private final List<Integer> attachedPorts = new CopyOnWriteArrayList<>();
    private volatile String attachFailure;

    public FakeDebugSessionManager withCurrent(DebugSession session) {
        sessions.add(session);
        current.set(session);
        return this;
    }

    public FakeDebugSessionManager failAttachWith(String message) {
        this.attachFailure = message;
        return this;
    }

    public List<Integer> attachedPorts() {
        return attachedPorts;
    }

    @Override
    public List<DebugSession> sessions() {
        return new ArrayList<>(sessions);
    }

    @Override
    public Optional<DebugSession> currentSession() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public DebugSession attach(String name, int port) throws IOException {
        if (attachFailure != null) {
            throw new IOException(attachFailure);
        }
        attachedPorts.add(port);
        var session = new FakeDebugSession(name);
        withCurrent(session);
        return session;
    }

    @Override
    public void detachCurrent() {
        DebugSession session = current.getAndSet(null);
        if (session != null) {
            sessions.remove(session);
        }
    }

    @Override
    public List<BreakpointInfo> breakpoints() {
        return List.copyOf(breakpoints);
    }

    @Override
    public boolean setBreakpoint(String file, int line) {
        if (breakpoints.stream().anyMatch(b -> b.file().equals(file) && b.line() == line)) {
            return false;
        }
        return breakpoints.add(new BreakpointInfo(file, line, null));
    }

    @Override
    public boolean removeBreakpoint(String file, int line) {
        return breakpoints.removeIf(b -> b.file().equals(file) && b.line() == line);
    }
}

package world.willfrog.agentrun.coordinator;

import world.willfrog.agentrun.model.ResponseEvent;
import world.willfrog.agentrun.turn.ResponseEventStream;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 按预设顺序产出事件的流，可以在第 n 次拉取时执行回调。
 */
class ScriptedEventStream implements ResponseEventStream {

    private final List<ResponseEvent> events;
    private final Map<Integer, Runnable> onPull = new HashMap<>();
    private int index;
    private volatile boolean closed;

    ScriptedEventStream(List<ResponseEvent> events) {
        this.events = events;
    }

    ScriptedEventStream onPull(int pullNumber, Runnable action) {
        onPull.put(pullNumber, action);
        return this;
    }

    @Override
    public boolean hasNext() {
        return !closed && index < events.size();
    }

    @Override
    public ResponseEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ResponseEvent event = events.get(index++);
        Runnable action = onPull.get(index);
        if (action != null) {
            action.run();
        }
        return event;
    }

    @Override
    public void close() {
        closed = true;
    }

    int pulls() {
        return index;
    }

    boolean isClosed() {
        return closed;
    }
}

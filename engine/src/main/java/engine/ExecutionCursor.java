package engine;

public final class ExecutionCursor {
    private int sequence;

    public int sequence() {
        return sequence;
    }

    int advance() {
        return sequence++;
    }
}

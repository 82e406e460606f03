package engine;

@FunctionalInterface
public interface Activity<I, O> {
    O execute(I input) throws Exception;
}

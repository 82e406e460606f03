package engine;

@FunctionalInterface
public interface Workflow<I, O> {
    O run(WorkflowContext context, I input) throws Exception;
}

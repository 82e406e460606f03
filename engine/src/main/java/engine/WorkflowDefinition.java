package engine;

import java.util.Objects;

public record WorkflowDefinition<I, O>(String type, Class<I> inputType, Class<O> outputType, Workflow<I, O> body) {
    public WorkflowDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(inputType, "inputType");
        Objects.requireNonNull(outputType, "outputType");
        Objects.requireNonNull(body, "body");
    }

    O run(WorkflowContext context, JsonCodec jsonCodec, HistoryLog log) throws Exception {
        I input = jsonCodec.fromTree(log.input(), inputType);
        return body.run(context, input);
    }
}

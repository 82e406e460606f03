package engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class WorkflowRegistry {
    private final Map<String, WorkflowDefinition<?, ?>> definitions = new LinkedHashMap<>();

    public <I, O> WorkflowRegistry register(String type, Class<I> inputType, Class<O> outputType, Workflow<I, O> body) {
        return register(new WorkflowDefinition<>(type, inputType, outputType, body));
    }

    public WorkflowRegistry register(WorkflowDefinition<?, ?> definition) {
        if (definitions.putIfAbsent(definition.type(), definition) != null) {
            throw new IllegalArgumentException("Workflow type already registered: " + definition.type());
        }
        return this;
    }

    WorkflowDefinition<?, ?> get(String type) {
        WorkflowDefinition<?, ?> definition = definitions.get(type);
        if (definition == null) {
            throw new IllegalArgumentException("No workflow registered for type: " + type);
        }
        return definition;
    }

    public boolean contains(String type) {
        return definitions.containsKey(type);
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(definitions.keySet());
    }
}

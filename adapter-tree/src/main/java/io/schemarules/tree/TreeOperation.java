package io.schemarules.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One API operation of the tree model: its parameters and optional request body schema. */
public final class TreeOperation {

    private final String operationId;
    private final List<TreeParameter> parameters = new ArrayList<>();
    private JsonSchema requestBody;

    public TreeOperation(String operationId) {
        this.operationId = Objects.requireNonNull(operationId, "operationId must not be null");
    }

    public String operationId() {
        return operationId;
    }

    public List<TreeParameter> parameters() {
        return parameters;
    }

    public TreeOperation addParameter(TreeParameter parameter) {
        parameters.add(Objects.requireNonNull(parameter, "parameter must not be null"));
        return this;
    }

    public JsonSchema requestBody() {
        return requestBody;
    }

    public TreeOperation requestBody(JsonSchema requestBody) {
        this.requestBody = requestBody;
        return this;
    }
}

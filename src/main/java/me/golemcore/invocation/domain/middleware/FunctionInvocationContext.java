package me.golemcore.invocation.domain.middleware;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.Tool;

import java.util.Map;

/**
 * State shared by the middlewares wrapping one function invocation.
 *
 * <p>
 * Middlewares may replace the arguments before calling the next step. Calling
 * {@link #terminate()} ends the invocation loop after the current batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionInvocationContext {

    private Tool function;
    private Map<String, Object> arguments;
    private Map<String, Object> additionalArguments;
    private FunctionCallContent functionCall;
    private int sequenceIndex;
    private int iteration;
    private boolean terminate;

    public void terminate() {
        this.terminate = true;
    }
}

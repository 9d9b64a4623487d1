package me.golemcore.invocation.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.invocation.domain.model.Content;
import me.golemcore.invocation.domain.model.FunctionApprovalRequestContent;
import me.golemcore.invocation.domain.model.FunctionApprovalResponseContent;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import me.golemcore.invocation.domain.model.FunctionResultContent;
import me.golemcore.invocation.domain.model.Message;
import me.golemcore.invocation.domain.model.Tool;
import me.golemcore.invocation.domain.model.ToolException;
import me.golemcore.invocation.domain.model.ToolFailureKind;
import me.golemcore.invocation.domain.model.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a batch of function calls may run now, needs caller approval,
 * or must be handed back to the caller untouched. Also folds approval responses
 * supplied by the caller back into the conversation.
 *
 * <p>
 * The whole batch is classified together: a single call needing approval turns
 * every call of the batch into an approval request.
 */
@Slf4j
public class FunctionApprovalGate {

    public static final String REJECTED_RESULT = "Error: Tool call invocation was rejected by user.";

    /**
     * Classifies model-issued calls. Approval responses replayed by the caller are
     * never passed through here.
     *
     * @throws ToolException
     *             with {@link ToolFailureKind#UNKNOWN_TOOL} when unknown calls are
     *             configured to terminate the loop
     */
    public ApprovalDecision classify(List<FunctionCallContent> calls, ToolRegistry registry,
            FunctionInvocationConfiguration configuration) {
        boolean approvalRequired = calls.stream()
                .map(call -> registry.resolve(call.getName()))
                .anyMatch(tool -> tool.map(Tool::requiresApproval).orElse(false));
        if (approvalRequired) {
            List<Content> requests = new ArrayList<>();
            for (FunctionCallContent call : calls) {
                requests.add(FunctionApprovalRequestContent.forCall(call));
            }
            log.info("[Approval] {} call(s) require approval", requests.size());
            return ApprovalDecision.approvalRequired(requests);
        }

        boolean returnToCaller = calls.stream().anyMatch(call -> isHandledByCaller(call, registry, configuration));
        if (returnToCaller) {
            log.debug("[Approval] Batch contains declaration-only calls, returning to caller");
            return ApprovalDecision.returnToCaller(calls);
        }

        if (configuration.isTerminateOnUnknownCalls()) {
            Optional<FunctionCallContent> unknown = calls.stream()
                    .filter(call -> !registry.contains(call.getName()))
                    .findFirst();
            if (unknown.isPresent()) {
                throw new ToolException(ToolFailureKind.UNKNOWN_TOOL,
                        "Requested function \"" + unknown.get().getName() + "\" not found");
            }
        }
        return ApprovalDecision.execute(calls);
    }

    private static boolean isHandledByCaller(FunctionCallContent call, ToolRegistry registry,
            FunctionInvocationConfiguration configuration) {
        if (configuration.isAdditionalTool(call.getName())) {
            return true;
        }
        return registry.resolve(call.getName()).map(Tool::isDeclarationOnly).orElse(false);
    }

    /**
     * Gathers approval responses from the conversation, keyed by request id.
     */
    public Map<String, FunctionApprovalResponseContent> collectApprovalResponses(List<Message> messages) {
        Map<String, FunctionApprovalResponseContent> responses = new LinkedHashMap<>();
        for (Message message : messages) {
            for (FunctionApprovalResponseContent response : message
                    .contentsOf(FunctionApprovalResponseContent.class)) {
                responses.put(response.getId(), response);
            }
        }
        return responses;
    }

    /**
     * Rewrites the conversation in place once approved calls have run.
     *
     * <p>
     * Approval requests become their function call again, unless the message
     * already carries a call with the same id. Approved responses are replaced by
     * the execution results in order, rejected responses by a rejection result.
     * Messages that receive a result become tool messages.
     *
     * @param responses
     *            responses whose ids are scheduled for handling
     * @param results
     *            results of the approved calls, in the order they were collected
     */
    public void replaceApprovalContentsWithResults(List<Message> messages,
            Map<String, FunctionApprovalResponseContent> responses, List<Content> results) {
        int resultIndex = 0;
        for (Message message : messages) {
            if (message.getContents() == null) {
                continue;
            }
            Set<String> existingCallIds = new HashSet<>();
            for (FunctionCallContent call : message.contentsOf(FunctionCallContent.class)) {
                if (call.getCallId() != null) {
                    existingCallIds.add(call.getCallId());
                }
            }

            ListIterator<Content> iterator = message.getContents().listIterator();
            while (iterator.hasNext()) {
                Content content = iterator.next();
                if (content instanceof FunctionApprovalRequestContent request) {
                    FunctionCallContent call = request.getFunctionCall();
                    if (call == null || existingCallIds.contains(call.getCallId())) {
                        iterator.remove();
                    } else {
                        iterator.set(call);
                        existingCallIds.add(call.getCallId());
                    }
                } else if (content instanceof FunctionApprovalResponseContent response
                        && responses.containsKey(response.getId())) {
                    if (response.isApproved()) {
                        if (resultIndex < results.size()) {
                            iterator.set(results.get(resultIndex++));
                            message.setRole(Message.ROLE_TOOL);
                        }
                    } else {
                        iterator.set(FunctionResultContent.success(callIdOf(response), REJECTED_RESULT));
                        message.setRole(Message.ROLE_TOOL);
                    }
                }
            }
        }
    }

    private static String callIdOf(FunctionApprovalResponseContent response) {
        return response.getFunctionCall() != null ? response.getFunctionCall().getCallId() : response.getId();
    }
}

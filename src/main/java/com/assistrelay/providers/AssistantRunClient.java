package com.assistrelay.providers;

import com.assistrelay.shared.model.RunHandle;
import com.assistrelay.shared.model.RunStatus;

public interface AssistantRunClient {

    RunHandle createRun(String inputText);

    RunStatus currentStatus(String threadId);

    RunStatus pollUntilTerminal(String threadId);

    String fetchLatestMessage(String threadId);
}

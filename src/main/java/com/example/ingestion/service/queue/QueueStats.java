package com.example.ingestion.service.queue;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueueStats {
    String consumerName;
    long streamLength;
    long pendingCount;
    long deadLetterCount;
}

package cn.bafuka.armorcache.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 操作指标快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationSnapshot {

    private long count;
    private long totalItems;

    @Builder.Default
    private Duration minDuration = Duration.ZERO;

    @Builder.Default
    private Duration maxDuration = Duration.ZERO;

    @Builder.Default
    private Duration avgDuration = Duration.ZERO;

    private long hits;
    private long misses;
    private long errors;
}

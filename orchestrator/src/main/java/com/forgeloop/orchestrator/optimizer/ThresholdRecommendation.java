package com.forgeloop.orchestrator.optimizer;

/**
 * Advisory change to one tunable threshold. Never applied by the optimizer;
 * see {@link ThresholdApprovalService}.
 */
public record ThresholdRecommendation(String parameterName,
                                      long oldValue,
                                      long newValue,
                                      Confidence confidence,
                                      int sampleSize,
                                      String reasoning) {}

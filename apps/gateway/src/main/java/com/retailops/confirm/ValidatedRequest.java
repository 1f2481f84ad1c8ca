package com.retailops.confirm;

import com.retailops.tools.ActionRequest;

import java.time.Instant;

/**
 * 已通过 token 校验的写请求。
 * {@code repeat=true}：token 之前已确认过，调用方只能按 {@code ledgerKey} 查账本，不能再执行。
 */
public record ValidatedRequest(ActionRequest request, String token, Instant confirmedAt,
                               String ledgerKey, boolean repeat) {}

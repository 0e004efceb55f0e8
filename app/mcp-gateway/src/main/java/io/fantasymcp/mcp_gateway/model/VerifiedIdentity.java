package io.fantasymcp.mcp_gateway.model;

import java.time.Instant;

/** 検証済み呼び出し元。リクエスト境界を越えて保持しない。 */
public record VerifiedIdentity(String subjectId, String issuer, Instant expiresAt) {}

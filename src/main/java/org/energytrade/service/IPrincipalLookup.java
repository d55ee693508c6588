package org.energytrade.service;

import org.energytrade.domain.AuthenticatedPrincipal;

import java.util.Optional;

/**
 * 已认证主体查询（外部会话系统的黑盒接口）
 */
public interface IPrincipalLookup {

    Optional<AuthenticatedPrincipal> findPrincipal(String userId);
}

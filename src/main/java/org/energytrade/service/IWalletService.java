package org.energytrade.service;

/**
 * 钱包余额校验（不执行扣款）
 */
public interface IWalletService {

    boolean hasSufficientFunds(String userId, double amount);
}

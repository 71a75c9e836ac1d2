package com.roundpilot.core.model;

/**
 * Betting side of a finished round.
 *
 * @param stake    amount staked for the round
 * @param autoStop auto-cashout multiplier in force
 * @param balance  own balance read at round end
 */
public record Earnings(double stake, double autoStop, double balance) {}

package net.gpumeter.core.model;

/** ACCEPTED: kill 요청이 기록됨(ack 대기), CANCELLED: 즉시 종료됨 */
public enum CancelOutcome { ACCEPTED, CANCELLED }

/**
 * 백그라운드 정리 작업 어댑터 패키지.
 *
 * <p>{@link com.ryuqq.jobstore.adapter.runner.Reaper}는 오래 processing 상태인 Job을
 * {@link com.ryuqq.jobstore.adapter.runner.ReconcileStrategy}에 따라 정리합니다.
 * 호출 주기는 애플리케이션이 정합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
package com.ryuqq.jobstore.adapter.runner;

/**
 * 쓰기 묶음 패키지.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
package com.ryuqq.jobstore.application.transaction;

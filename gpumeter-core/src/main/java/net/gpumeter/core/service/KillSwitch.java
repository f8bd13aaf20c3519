package net.gpumeter.core.service;

import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.model.KillReason;
import net.gpumeter.core.spi.Clock;
import net.gpumeter.core.spi.KillCommandRepository;
import net.gpumeter.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** kill 명령 채널 (at-least-once, ack 필수). 잡당 PENDING 명령은 하나 */
public final class KillSwitch {
    private static final Logger log = LoggerFactory.getLogger(KillSwitch.class);

    private final KillCommandRepository commands;
    private final BillingPolicy policy;
    private final TxRunner tx;
    private final Clock clock;

    public KillSwitch(KillCommandRepository commands, BillingPolicy policy, TxRunner tx, Clock clock) {
        this.commands = commands;
        this.policy = policy;
        this.tx = tx;
        this.clock = clock;
    }

    /** 잡 행 잠금 보유 상태에서 호출. 이미 PENDING이 있으면 그것을 반환 */
    public KillCommand issue(JobRecord job, KillReason reason) throws Exception {
        var existing = commands.findPendingByJob(job.id());
        if (existing.isPresent()) return existing.get();
        var now = clock.now();
        KillCommand cmd = commands.insert(job.id(), reason, now, now.plus(policy.killAckTimeout(job.tickSeconds())));
        log.info("kill issued: job={} reason={} ackDeadline={}", job.id(), reason.code(), cmd.ackDeadline());
        return cmd;
    }

    /** 워커 폴링: 미확인 명령 재전달 */
    public List<KillCommand> pollPending(int limit) throws Exception {
        return tx.required(() -> commands.pollPending(limit));
    }
}

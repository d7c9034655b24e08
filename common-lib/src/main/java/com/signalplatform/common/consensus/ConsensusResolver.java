package com.signalplatform.common.consensus;

import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.ConsensusDecision;
import com.signalplatform.common.model.JudgeOpinion;

import java.util.List;

/**
 * Strategy contract for reducing judge opinions to one {@link ConsensusDecision}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Pure</b>: the decision depends only on the opinions and the thresholds snapshot</li>
 *   <li><b>Order-aware</b>: {@code opinions} arrive in configured judge order, which is the
 *       tie-break order</li>
 *   <li><b>Non-null</b>: always return a decision, NO_TRADE when in doubt</li>
 * </ul>
 *
 * <p>Current implementation: {@link AgreementConsensusStrategy}.
 */
public interface ConsensusResolver {

    /**
     * @param opinions   every configured judge's opinion, failed ones included
     * @param thresholds the thresholds snapshot taken for this invocation
     * @return a {@link ConsensusDecision}, never {@code null}
     */
    ConsensusDecision resolve(List<JudgeOpinion> opinions, AdaptiveThresholds thresholds);
}

package com.questrail.chamber.control.internal.exec;

import com.questrail.chamber.control.internal.state.ChamberIntents;
import com.questrail.chamber.control.internal.state.ChamberState;

/**
 * ChamberIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure phase state machine and the hardware
 * and storage it controls.
 *
 * <h2>Role in the architecture</h2>
 * Realizes the actuator and checkpoint intents produced by the
 * {@link com.questrail.chamber.control.internal.state.PhaseReducer}. It is the
 * only layer allowed to:
 * <ul>
 *   <li>command the actuator driver</li>
 *   <li>write or remove the checkpoint</li>
 * </ul>
 *
 * Status publication is handled by the coordinator itself, so
 * {@code BROADCAST_STATUS} is ignored here.
 *
 * <h2>Feedback</h2>
 * The interface returns nothing. Outcomes the state machine must know about
 * (an actuator command failing or recovering) are reported back as
 * {@link com.questrail.chamber.control.internal.events.ChamberEvent}s.
 *
 * <p>Called with the coordinator lock held.</p>
 */
public interface ChamberIntentExecutor
{
    /**
     * Execute the intents against the state the reducer produced with them.
     *
     * @param state   state after the event
     * @param intents side effects to perform
     */
    void execute(ChamberState state, ChamberIntents intents);
}

package com.roundpilot.core.actuator;

import com.roundpilot.core.model.ScreenPoint;

import java.time.Duration;

/**
 * Physical pointer and keyboard. Only the {@link InputActuator} thread may drive it.
 * Any operation may throw {@link ActuatorAbortedException}.
 */
public interface InputDevice {

    void click(ScreenPoint point);

    /** Selects all text in the focused field. */
    void selectAll();

    void type(String text, Duration keystrokeInterval);
}

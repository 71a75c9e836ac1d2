package com.roundpilot.core.actuator;

import com.roundpilot.core.model.ScreenPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.HeadlessException;
import java.awt.MouseInfo;
import java.awt.Point;
import java.awt.PointerInfo;
import java.awt.Robot;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.time.Duration;

/**
 * {@link InputDevice} driven through {@link Robot}.
 * <p>
 * With the fail-safe enabled, every operation first checks the pointer: parking it in
 * the top-left screen corner aborts the current action.
 */
public class RobotInputDevice implements InputDevice {

    private static final Logger log = LoggerFactory.getLogger(RobotInputDevice.class);

    private final Robot robot;
    private final boolean failSafe;

    public RobotInputDevice(Robot robot, boolean failSafe) {
        this.robot = robot;
        this.failSafe = failSafe;
        this.robot.setAutoDelay(0);
    }

    /**
     * @throws ActuatorAbortedException if the environment has no input device
     */
    public static RobotInputDevice create(boolean failSafe) {
        try {
            return new RobotInputDevice(new Robot(), failSafe);
        } catch (AWTException | SecurityException | HeadlessException e) {
            throw new ActuatorAbortedException("Input device unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public void click(ScreenPoint point) {
        checkFailSafe();
        robot.mouseMove(point.x(), point.y());
        robot.mousePress(InputEvent.BUTTON1_DOWN_MASK);
        robot.mouseRelease(InputEvent.BUTTON1_DOWN_MASK);
    }

    @Override
    public void selectAll() {
        checkFailSafe();
        robot.keyPress(KeyEvent.VK_CONTROL);
        try {
            robot.keyPress(KeyEvent.VK_A);
            robot.keyRelease(KeyEvent.VK_A);
        } finally {
            robot.keyRelease(KeyEvent.VK_CONTROL);
        }
    }

    @Override
    public void type(String text, Duration keystrokeInterval) {
        for (char c : text.toCharArray()) {
            checkFailSafe();
            int keyCode = keyCodeFor(c);
            robot.keyPress(keyCode);
            robot.keyRelease(keyCode);
            robot.delay((int) keystrokeInterval.toMillis());
        }
    }

    private static int keyCodeFor(char c) {
        if (c >= '0' && c <= '9') {
            return KeyEvent.VK_0 + (c - '0');
        }
        if (c == '.') {
            return KeyEvent.VK_PERIOD;
        }
        throw new ActuatorAbortedException("Cannot type character '" + c + "'");
    }

    private void checkFailSafe() {
        if (!failSafe) {
            return;
        }
        PointerInfo pointer = MouseInfo.getPointerInfo();
        if (pointer == null) {
            return;
        }
        Point location = pointer.getLocation();
        if (location.x == 0 && location.y == 0) {
            log.warn("Fail-safe triggered: pointer in the top-left corner");
            throw new ActuatorAbortedException("Fail-safe triggered by pointer in the top-left corner");
        }
    }
}

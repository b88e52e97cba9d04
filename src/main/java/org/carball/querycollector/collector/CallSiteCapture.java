package org.carball.querycollector.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.querycollector.model.query.CallSiteFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures the frames of the thread issuing a statement, minus the collector's own frames on top.
 */
@Slf4j
final class CallSiteCapture {

    private static final List<String> OWN_FRAME_CLASSES = List.of(
            Thread.class.getName(),
            CallSiteCapture.class.getName(),
            QueryCollector.class.getName()
    );

    private CallSiteCapture() {
    }

    /**
     * @param maxDepth frames to keep; zero or negative keeps all of them
     */
    static List<CallSiteFrame> capture(int maxDepth) {
        try {
            StackTraceElement[] elements = Thread.currentThread().getStackTrace();

            int first = 0;
            while (first < elements.length && isOwnFrame(elements[first].getClassName())) {
                first++;
            }

            int last = maxDepth > 0 ? Math.min(elements.length, first + maxDepth) : elements.length;
            List<CallSiteFrame> frames = new ArrayList<>(last - first);
            for (int i = first; i < last; i++) {
                frames.add(CallSiteFrame.from(elements[i]));
            }
            return frames;
        } catch (RuntimeException e) {
            log.debug("Could not capture call site: {}", e.getMessage());
            return List.of();
        }
    }

    private static boolean isOwnFrame(String className) {
        for (String own : OWN_FRAME_CLASSES) {
            if (className.equals(own) || className.startsWith(own + "$")) {
                return true;
            }
        }
        return false;
    }
}

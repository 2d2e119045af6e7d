package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Sleep {

    /**
     * @return true if the sleep was interrupted
     */
    public static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            log.error("Sleeping for {} milliseconds was interrupted.", millis);
            Thread.currentThread().interrupt();
            return true;
        }
        return false;
    }

}

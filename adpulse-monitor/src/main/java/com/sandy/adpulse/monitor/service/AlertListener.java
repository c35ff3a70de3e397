package com.sandy.adpulse.monitor.service;

import com.sandy.adpulse.monitor.entity.ActiveAlert;

public interface AlertListener {

    default void onAlertTriggered(ActiveAlert alert) {
    }

    default void onAlertResolved(ActiveAlert alert) {
    }
}

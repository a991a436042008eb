package com.gdin.radiology.report.notification;

/**
 * 危急值通知的投递渠道
 */
public interface NotificationDispatcher {

    /**
     * @return 投递成功返回 true
     */
    boolean dispatch(CriticalFindingNotification notification);
}

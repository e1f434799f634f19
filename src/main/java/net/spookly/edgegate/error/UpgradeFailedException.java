package net.spookly.edgegate.error;

/**
 * A protocol upgrade was requested but the backend did not switch protocols.
 */
public class UpgradeFailedException extends ProxyException {
    public UpgradeFailedException(String message) {
        super(ProxyErrorCode.UPGRADE_FAILED, message);
    }

    public UpgradeFailedException(String message, Throwable cause) {
        super(ProxyErrorCode.UPGRADE_FAILED, message, cause);
    }
}

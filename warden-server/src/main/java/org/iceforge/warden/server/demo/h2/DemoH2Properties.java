package org.iceforge.warden.server.demo.h2;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Demo-only dataset seeded into the configured database on startup.
 *
 * Opt-in via: warden.demo.h2.enabled=true
 */
@ConfigurationProperties(prefix = "warden.demo.h2")
public class DemoH2Properties {

    /** Seed customers, orders and demo grants on startup. */
    private boolean enabled = false;

    /** Region the demo "analyst" user is restricted to. */
    private String analystRegion = "US";

    /** Login password of every demo user. */
    private String password = "warden-demo";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getAnalystRegion() { return analystRegion; }
    public void setAnalystRegion(String analystRegion) { this.analystRegion = analystRegion; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
}

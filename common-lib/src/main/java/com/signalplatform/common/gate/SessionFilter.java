package com.signalplatform.common.gate;

import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.MicrostructureSnapshot;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Advisory. Prefers an allowed trading session outside the news window.
 */
public class SessionFilter implements PreTradeFilter {

    public static final String NAME = "session";

    static final double NEWS_WINDOW_SCORE  = 0.7;
    static final double OFF_SESSION_SCORE  = 0.3;

    private final GateSettings.Session settings;

    public SessionFilter(GateSettings.Session settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean critical() {
        return false;
    }

    @Override
    public FilterResult evaluate(MicrostructureSnapshot snapshot) {
        Set<TradingSession> active = EnumSet.noneOf(TradingSession.class);
        active.addAll(TradingSessionClassifier.activeSessions(snapshot.observedAt()));
        active.retainAll(settings.allowedSessions());
        boolean news = TradingSessionClassifier.isNewsWindow(snapshot.observedAt(), settings.newsBufferMinutes());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activeSessions", active.toString());
        details.put("newsWindow", news);

        if (active.isEmpty()) {
            return FilterResult.fail(NAME, false, OFF_SESSION_SCORE, "Outside allowed trading sessions", details);
        }
        if (news) {
            return FilterResult.fail(NAME, false, NEWS_WINDOW_SCORE,
                "Inside news window (first " + settings.newsBufferMinutes() + " minutes of the hour)", details);
        }
        return FilterResult.pass(NAME, false, 1.0, "Active session " + active, details);
    }
}

package com.ai.dialer.component;

import com.ai.dialer.model.ConferenceOptions;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Call-control markup that bridges a leg into a named conference. Every call in the dialer
 * is a conference, even one-to-one, so legs can be added and removed without cutting audio.
 */
@Component
public class ConferenceTwimlBuilder {

    private static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    public String joinConference(String conferenceName, ConferenceOptions options) {
        StringBuilder conference = new StringBuilder("<Conference")
                .append(attribute("beep", String.valueOf(options.beep())))
                .append(attribute("startConferenceOnEnter", String.valueOf(options.startOnEnter())))
                .append(attribute("endConferenceOnExit", String.valueOf(options.endOnExit())));
        if (StringUtils.isNotBlank(options.waitUrl())) {
            conference.append(attribute("waitUrl", options.waitUrl()));
        }
        if (StringUtils.isNotBlank(options.participantLabel())) {
            conference.append(attribute("participantLabel", options.participantLabel()));
        }
        conference.append('>').append(escapeXml(conferenceName)).append("</Conference>");
        return XML_HEADER + "<Response><Dial>" + conference + "</Dial></Response>";
    }

    /** Bridges the answering leg to a single number, presenting {@code callerId}. */
    public String dialNumber(String to, String callerId) {
        return XML_HEADER + "<Response><Dial" + attribute("callerId", callerId) + "><Number>"
                + escapeXml(to) + "</Number></Dial></Response>";
    }

    public String hangup() {
        return XML_HEADER + "<Response><Hangup/></Response>";
    }

    private static String attribute(String name, String value) {
        return " " + name + "=\"" + escapeXml(value) + "\"";
    }

    static String escapeXml(String raw) {
        if (raw == null) return "";
        return raw
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;");
    }
}

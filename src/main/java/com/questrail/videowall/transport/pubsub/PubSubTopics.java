package com.questrail.videowall.transport.pubsub;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Topic names the video wall listens and answers on.
 *
 * @param checkupRequest topic on which status requests arrive
 * @param checkupReply   topic status summaries are published to
 * @param command        topic carrying signed remote commands
 * @param events         topics carrying sensor event JSON
 */
public record PubSubTopics(
    String checkupRequest,
    String checkupReply,
    String command,
    List<String> events
) {
    public static final String DEFAULT_CHECKUP_REQUEST = "reporter/checkup_req";
    public static final String DEFAULT_CHECKUP_REPLY = "reporter/checkup";
    public static final List<String> DEFAULT_EVENTS = List.of("daisy/event", "daisy/checkup");

    public PubSubTopics {
        Objects.requireNonNull(checkupRequest, "checkupRequest");
        Objects.requireNonNull(checkupReply, "checkupReply");
        Objects.requireNonNull(command, "command");
        events = List.copyOf(Objects.requireNonNull(events, "events"));
    }

    /**
     * Default topics for a monitor called {@code name}; commands arrive on
     * {@code <name>/cmd}.
     */
    public static PubSubTopics defaults(String name)
    {
        Objects.requireNonNull(name, "name");
        return new PubSubTopics(DEFAULT_CHECKUP_REQUEST, DEFAULT_CHECKUP_REPLY, name + "/cmd", DEFAULT_EVENTS);
    }

    List<String> all()
    {
        List<String> all = new ArrayList<>();
        all.add(checkupRequest);
        all.add(command);
        all.addAll(events);
        return all;
    }
}

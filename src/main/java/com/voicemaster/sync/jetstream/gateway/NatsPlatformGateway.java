package com.voicemaster.sync.jetstream.gateway;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voicemaster.sync.core.platform.ChannelKind;
import com.voicemaster.sync.core.platform.PermissionSubject;
import com.voicemaster.sync.core.platform.PlatformChannel;
import com.voicemaster.sync.core.platform.PlatformException;
import com.voicemaster.sync.core.platform.PlatformGateway;
import com.voicemaster.sync.jetstream.config.NatsProperties;

import io.nats.client.Connection;
import io.nats.client.Message;

/**
 * {@link PlatformGateway} backed by NATS request/reply to a platform bridge process that owns the
 * chat-platform client (and its rate limiting).
 *
 * <h2>Wire format</h2>
 * <ul>
 *   <li>Request subject: {@code <platform-subject-prefix>.<operation>}, e.g.
 *       {@code voicemaster.platform.channel.create}.</li>
 *   <li>Request body: JSON object with the operation's arguments.</li>
 *   <li>Reply: {@code {"ok":true, ...}} with operation-specific fields, or
 *       {@code {"ok":false,"error":"NOT_FOUND|FORBIDDEN|UNAVAILABLE","message":"..."}}.</li>
 * </ul>
 *
 * <h2>Failure mapping</h2>
 * No reply within {@code request-timeout}, no responders, a closed connection or an unreadable
 * reply all surface as {@link PlatformException.Kind#UNAVAILABLE}.
 */
@Component
public class NatsPlatformGateway implements PlatformGateway {

    private static final Logger log = LoggerFactory.getLogger(NatsPlatformGateway.class);

    static final String CREATE_CATEGORY = "category.create";
    static final String CREATE_CHANNEL = "channel.create";
    static final String DELETE_CHANNEL = "channel.delete";
    static final String MOVE_MEMBER = "member.move";
    static final String RENAME_CHANNEL = "channel.rename";
    static final String SET_LIMIT = "channel.limit";
    static final String SET_PERMISSION = "channel.permission";
    static final String CURRENT_MEMBERS = "channel.members";
    static final String CHANNEL_INFO = "channel.info";

    private final Connection connection;
    private final ObjectMapper mapper;
    private final String prefix;
    private final Duration timeout;

    public NatsPlatformGateway(Connection connection, ObjectMapper mapper, NatsProperties props) {
        this.connection = connection;
        this.mapper = mapper;
        this.prefix = props.getPlatformSubjectPrefix();
        this.timeout = props.getRequestTimeout();
    }

    @Override
    public long createCategory(long guildId, String name) {
        ObjectNode body = mapper.createObjectNode()
                .put("guildId", guildId)
                .put("name", name);
        return createdId(CREATE_CATEGORY, request(CREATE_CATEGORY, body));
    }

    @Override
    public long createChannel(long guildId, long categoryId, String name, int userLimit) {
        ObjectNode body = mapper.createObjectNode()
                .put("guildId", guildId)
                .put("categoryId", categoryId)
                .put("name", name)
                .put("userLimit", userLimit);
        return createdId(CREATE_CHANNEL, request(CREATE_CHANNEL, body));
    }

    @Override
    public void deleteChannel(long channelId) {
        request(DELETE_CHANNEL, mapper.createObjectNode().put("channelId", channelId));
    }

    @Override
    public void moveMember(long guildId, long userId, long channelId) {
        request(MOVE_MEMBER, mapper.createObjectNode()
                .put("guildId", guildId)
                .put("userId", userId)
                .put("channelId", channelId));
    }

    @Override
    public void renameChannel(long channelId, String name) {
        request(RENAME_CHANNEL, mapper.createObjectNode()
                .put("channelId", channelId)
                .put("name", name));
    }

    @Override
    public void setLimit(long channelId, int userLimit) {
        request(SET_LIMIT, mapper.createObjectNode()
                .put("channelId", channelId)
                .put("userLimit", userLimit));
    }

    @Override
    public void setPermission(long channelId, PermissionSubject subject, boolean allow) {
        request(SET_PERMISSION, mapper.createObjectNode()
                .put("channelId", channelId)
                .put("subjectType", subject.type().name())
                .put("subjectId", subject.id())
                .put("allow", allow));
    }

    @Override
    public Set<Long> currentMembers(long channelId) {
        JsonNode reply = request(CURRENT_MEMBERS, mapper.createObjectNode().put("channelId", channelId));
        Set<Long> members = new LinkedHashSet<>();
        for (JsonNode id : reply.path("members")) {
            members.add(id.asLong());
        }
        return members;
    }

    @Override
    public Optional<PlatformChannel> channelInfo(long channelId) {
        JsonNode reply;
        try {
            reply = request(CHANNEL_INFO, mapper.createObjectNode().put("channelId", channelId));
        } catch (PlatformException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        JsonNode channel = reply.path("channel");
        if (channel.isMissingNode() || channel.isNull()) {
            return Optional.empty();
        }
        JsonNode parent = channel.path("parentId");
        return Optional.of(new PlatformChannel(
                channel.path("id").asLong(channelId),
                channel.path("guildId").asLong(),
                parseKind(channel.path("kind").asText()),
                parent.isMissingNode() || parent.isNull() ? null : parent.asLong(),
                channel.path("name").asText(null),
                channel.path("userLimit").asInt(0)));
    }

    JsonNode request(String operation, ObjectNode body) {
        String subject = prefix + "." + operation;
        Message reply;
        try {
            reply = connection.request(subject, mapper.writeValueAsBytes(body), timeout);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PlatformException(PlatformException.Kind.UNAVAILABLE, operation + " interrupted", ie);
        } catch (IOException | IllegalStateException e) {
            throw new PlatformException(PlatformException.Kind.UNAVAILABLE,
                    operation + " could not be sent: " + e.getMessage(), e);
        }

        if (reply == null) {
            throw new PlatformException(PlatformException.Kind.UNAVAILABLE,
                    operation + " timed out after " + timeout.toMillis() + "ms");
        }
        if (reply.isStatusMessage()) {
            throw new PlatformException(PlatformException.Kind.UNAVAILABLE,
                    operation + " not answered: " + reply.getStatus().getMessage());
        }

        JsonNode json;
        try {
            json = mapper.readTree(reply.getData());
        } catch (IOException e) {
            throw new PlatformException(PlatformException.Kind.UNAVAILABLE,
                    operation + " returned an unreadable reply", e);
        }

        if (!json.path("ok").asBoolean(false)) {
            PlatformException.Kind kind = parseErrorKind(json.path("error").asText());
            String message = json.path("message").asText(operation + " failed");
            log.debug("Platform call failed op={} kind={} msg={}", operation, kind, message);
            throw new PlatformException(kind, message);
        }
        return json;
    }

    private static long createdId(String operation, JsonNode reply) {
        JsonNode id = reply.path("channelId");
        if (!id.canConvertToLong() || id.asLong() <= 0) {
            throw new PlatformException(PlatformException.Kind.UNAVAILABLE,
                    operation + " reply carries no channel id");
        }
        return id.asLong();
    }

    private static PlatformException.Kind parseErrorKind(String error) {
        if ("NOT_FOUND".equals(error)) return PlatformException.Kind.NOT_FOUND;
        if ("FORBIDDEN".equals(error)) return PlatformException.Kind.FORBIDDEN;
        return PlatformException.Kind.UNAVAILABLE;
    }

    private static ChannelKind parseKind(String kind) {
        if ("VOICE".equals(kind)) return ChannelKind.VOICE;
        if ("CATEGORY".equals(kind)) return ChannelKind.CATEGORY;
        return ChannelKind.OTHER;
    }
}

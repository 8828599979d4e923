package io.lanmesh.network.handshake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Messages exchanged before a connection is admitted. Each is serialized as a
 * single JSON object discriminated by its {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HandshakeMessage.InfoRequest.class, name = "info_request"),
    @JsonSubTypes.Type(value = HandshakeMessage.InfoResponse.class, name = "info_response"),
    @JsonSubTypes.Type(value = HandshakeMessage.ConnectRequest.class, name = "connect_request"),
    @JsonSubTypes.Type(value = HandshakeMessage.ConnectAccept.class, name = "connect_accept"),
    @JsonSubTypes.Type(value = HandshakeMessage.ConnectReject.class, name = "connect_reject")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public interface HandshakeMessage {

    @JsonTypeName("info_request")
    record InfoRequest(@JsonProperty("peer_id") String peerId) implements HandshakeMessage {}

    @JsonTypeName("info_response")
    record InfoResponse(
        @JsonProperty("app_name") String appName,
        @JsonProperty("peer_id") String peerId,
        @JsonProperty("accepting") boolean accepting,
        @JsonProperty("seeking") boolean seeking
    ) implements HandshakeMessage {}

    @JsonTypeName("connect_request")
    record ConnectRequest(
        @JsonProperty("peer_id") String peerId,
        @JsonProperty("app_name") String appName
    ) implements HandshakeMessage {}

    @JsonTypeName("connect_accept")
    record ConnectAccept(@JsonProperty("peer_id") String peerId) implements HandshakeMessage {}

    @JsonTypeName("connect_reject")
    record ConnectReject(@JsonProperty("reason") String reason) implements HandshakeMessage {}
}

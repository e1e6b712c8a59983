package com.studyroom.studyroom_api.presence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 프로세스 내 방별 실시간 연결 레지스트리.
 * <p>
 * 방마다 락이 따로 있고 전체를 잠그는 락은 없다. 재시작하면 비어 있으므로 클라이언트가 다시 입장해야 한다.
 * 여러 인스턴스로 늘리려면 방별 pub/sub 토픽으로 교체해야 한다.
 */
@Slf4j
@Component
public class PresenceBroadcaster {

    private final ConcurrentMap<String, RoomChannel> rooms = new ConcurrentHashMap<>();

    /**
     * 같은 사용자의 기존 연결이 있으면 교체하고 기존 연결은 닫는다.
     */
    public void register(String roomId, LiveConnection connection) {
        AtomicReference<Optional<LiveConnection>> replaced = new AtomicReference<>(Optional.empty());
        rooms.compute(roomId, (key, channel) -> {
            RoomChannel target = channel != null ? channel : new RoomChannel(key);
            replaced.set(target.put(connection));
            return target;
        });
        replaced.get().ifPresent(previous -> {
            log.info("[Presence] replaced connection roomId={} userId={} previous={} current={}",
                    roomId, connection.userId(), previous.id(), connection.id());
            previous.close();
        });
    }

    /**
     * @return 이 연결이 해당 사용자의 현재 연결이었으면 true
     */
    public boolean deregister(String roomId, LiveConnection connection) {
        AtomicBoolean removed = new AtomicBoolean(false);
        rooms.computeIfPresent(roomId, (key, channel) -> {
            removed.set(channel.remove(connection));
            return channel.isEmpty() ? null : channel;
        });
        return removed.get();
    }

    /**
     * 사용자의 연결을 방에서 떼어 낸다. 닫는 것은 호출자 몫이다.
     */
    public Optional<LiveConnection> evict(String roomId, String userId) {
        AtomicReference<Optional<LiveConnection>> evicted = new AtomicReference<>(Optional.empty());
        rooms.computeIfPresent(roomId, (key, channel) -> {
            evicted.set(channel.removeUser(userId));
            return channel.isEmpty() ? null : channel;
        });
        return evicted.get();
    }

    public int broadcast(String roomId, RoomEvent event, String excludeConnectionId) {
        RoomChannel channel = rooms.get(roomId);
        return channel == null ? 0 : channel.deliver(event, excludeConnectionId);
    }

    /**
     * 입장 이벤트. 같은 입장 기록의 퇴장 이벤트가 먼저 나갔다면 보내지 않는다.
     */
    public int announceJoin(String roomId, Long attendanceId, RoomEvent event, String excludeConnectionId) {
        RoomChannel channel = rooms.get(roomId);
        return channel == null ? 0 : channel.deliverJoin(attendanceId, event, excludeConnectionId);
    }

    public int announceLeave(String roomId, Long attendanceId, RoomEvent event) {
        RoomChannel channel = rooms.get(roomId);
        return channel == null ? 0 : channel.deliverLeave(attendanceId, event);
    }

    public void seedMedia(String roomId, ParticipantMediaState initial) {
        RoomChannel channel = rooms.get(roomId);
        if (channel != null) {
            channel.seedMedia(initial);
        }
    }

    /**
     * sender 가 현재 연결이 아니거나 방이 없으면 빈 값.
     */
    public Optional<ParticipantMediaState> changeMedia(
            String roomId,
            LiveConnection sender,
            UnaryOperator<ParticipantMediaState> change,
            Function<ParticipantMediaState, RoomEvent> eventFactory
    ) {
        RoomChannel channel = rooms.get(roomId);
        return channel == null ? Optional.empty() : channel.changeMedia(sender, change, eventFactory);
    }

    public List<ParticipantMediaState> mediaStates(String roomId) {
        RoomChannel channel = rooms.get(roomId);
        return channel == null ? List.of() : channel.mediaStates();
    }

    /**
     * 방의 모든 연결에 마지막 이벤트를 보내고 닫은 뒤 레지스트리에서 지운다.
     *
     * @return 닫은 연결 수
     */
    public int closeRoom(String roomId, RoomEvent finalEvent) {
        RoomChannel channel = rooms.remove(roomId);
        if (channel == null) {
            return 0;
        }
        List<LiveConnection> evicted = channel.close(finalEvent);
        log.info("[Presence] room closed roomId={} evicted={}", roomId, evicted.size());
        return evicted.size();
    }

    public int connectionCount(String roomId) {
        RoomChannel channel = rooms.get(roomId);
        return channel == null ? 0 : channel.size();
    }

    public RoomStats roomStats() {
        List<RoomStats.RoomStat> stats = rooms.values().stream()
                .map(channel -> new RoomStats.RoomStat(channel.roomId(), channel.size(), channel.createdAt()))
                .sorted(Comparator.comparing(RoomStats.RoomStat::createdAt))
                .toList();
        int totalConnections = stats.stream().mapToInt(RoomStats.RoomStat::connectionCount).sum();
        return new RoomStats(stats.size(), totalConnections, stats);
    }
}

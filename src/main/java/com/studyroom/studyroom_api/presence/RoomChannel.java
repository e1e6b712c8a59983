package com.studyroom.studyroom_api.presence;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 방 하나의 연결 집합. 모든 접근은 이 방의 lock 안에서만 일어난다.
 */
@Slf4j
final class RoomChannel {

    private final String roomId;
    private final Instant createdAt = Instant.now();
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, LiveConnection> connectionsByUser = new LinkedHashMap<>();
    // 퇴장 이벤트가 이미 나간 입장 기록. 늦게 도착한 입장 이벤트를 버리는 데 쓴다.
    private final Set<Long> departedAttendances = new HashSet<>();
    // 연결이 교체돼도 유지되고, 방에서 빠질 때 함께 지운다
    private final Map<String, ParticipantMediaState> mediaByUser = new LinkedHashMap<>();
    private boolean closed;

    RoomChannel(String roomId) {
        this.roomId = roomId;
    }

    String roomId() {
        return roomId;
    }

    Instant createdAt() {
        return createdAt;
    }

    <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    Optional<LiveConnection> put(LiveConnection connection) {
        return locked(() -> {
            LiveConnection previous = connectionsByUser.put(connection.userId(), connection);
            if (previous == null || previous.id().equals(connection.id())) {
                return Optional.empty();
            }
            return Optional.of(previous);
        });
    }

    boolean remove(LiveConnection connection) {
        return locked(() -> {
            LiveConnection current = connectionsByUser.get(connection.userId());
            if (current == null || !current.id().equals(connection.id())) {
                return false;
            }
            connectionsByUser.remove(connection.userId());
            mediaByUser.remove(connection.userId());
            return true;
        });
    }

    Optional<LiveConnection> removeUser(String userId) {
        return locked(() -> {
            mediaByUser.remove(userId);
            return Optional.ofNullable(connectionsByUser.remove(userId));
        });
    }

    /**
     * 연결이 있는 사용자에게만, 이미 상태가 있으면 그대로 둔다.
     */
    void seedMedia(ParticipantMediaState initial) {
        locked(() -> {
            if (!closed && connectionsByUser.containsKey(initial.userId())) {
                mediaByUser.putIfAbsent(initial.userId(), initial);
            }
            return null;
        });
    }

    /**
     * sender 가 이 사용자의 현재 연결일 때만 상태를 바꾸고, sender 를 뺀 방 전체에 알린다.
     */
    Optional<ParticipantMediaState> changeMedia(
            LiveConnection sender,
            UnaryOperator<ParticipantMediaState> change,
            Function<ParticipantMediaState, RoomEvent> eventFactory
    ) {
        return locked(() -> {
            LiveConnection current = connectionsByUser.get(sender.userId());
            if (closed || current == null || !current.id().equals(sender.id())) {
                return Optional.empty();
            }
            ParticipantMediaState base = mediaByUser.getOrDefault(
                    sender.userId(), ParticipantMediaState.onEntry(sender.userId(), null, false));
            ParticipantMediaState changed = change.apply(base);
            mediaByUser.put(sender.userId(), changed);
            fanOut(eventFactory.apply(changed), sender.id());
            return Optional.of(changed);
        });
    }

    List<ParticipantMediaState> mediaStates() {
        return locked(() -> List.copyOf(mediaByUser.values()));
    }

    boolean isEmpty() {
        return locked(connectionsByUser::isEmpty);
    }

    int size() {
        return locked(connectionsByUser::size);
    }

    int deliver(RoomEvent event, String excludeConnectionId) {
        return locked(() -> closed ? 0 : fanOut(event, excludeConnectionId));
    }

    int deliverJoin(Long attendanceId, RoomEvent event, String excludeConnectionId) {
        return locked(() -> {
            if (closed || (attendanceId != null && departedAttendances.contains(attendanceId))) {
                return 0;
            }
            return fanOut(event, excludeConnectionId);
        });
    }

    int deliverLeave(Long attendanceId, RoomEvent event) {
        return locked(() -> {
            if (attendanceId != null) {
                departedAttendances.add(attendanceId);
            }
            return closed ? 0 : fanOut(event, null);
        });
    }

    /**
     * 마지막 이벤트를 보내고 모든 연결을 닫는다. 이후 전달 요청은 무시된다.
     */
    List<LiveConnection> close(RoomEvent finalEvent) {
        return locked(() -> {
            closed = true;
            List<LiveConnection> evicted = new ArrayList<>(connectionsByUser.values());
            connectionsByUser.clear();
            mediaByUser.clear();
            for (LiveConnection connection : evicted) {
                connection.send(finalEvent);
                connection.close();
            }
            return evicted;
        });
    }

    private int fanOut(RoomEvent event, String excludeConnectionId) {
        int delivered = 0;
        for (LiveConnection connection : connectionsByUser.values()) {
            if (connection.id().equals(excludeConnectionId)) {
                continue;
            }
            if (connection.send(event)) {
                delivered++;
            } else {
                log.warn("[RoomChannel] dropped event roomId={} connectionId={} type={}",
                        roomId, connection.id(), event.type().wireName());
            }
        }
        return delivered;
    }
}

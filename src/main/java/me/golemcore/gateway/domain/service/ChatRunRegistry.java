package me.golemcore.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.gateway.domain.model.ChatRunEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * FIFO of outstanding chat requests per session id.
 *
 * <p>
 * The session id is the id the agent executes the chat under (the internal run
 * id). The next completing run for it is paired with the oldest pending
 * request, since client run ids are chosen by clients and are not unique across
 * the gateway. Entries are consumed from the front, except for
 * {@link #remove(String, String, String)} which cleans up aborted requests
 * wherever they sit in the queue. Empty queues are deleted.
 */
@Component
public class ChatRunRegistry {

    private final Object lock = new Object();
    private final Map<String, Deque<ChatRunEntry>> queues = new HashMap<>();

    public void add(String sessionId, ChatRunEntry entry) {
        if (StringValueSupport.isBlank(sessionId) || entry == null) {
            return;
        }
        synchronized (lock) {
            queues.computeIfAbsent(sessionId, key -> new ArrayDeque<>()).addLast(entry);
        }
    }

    public ChatRunEntry peek(String sessionId) {
        synchronized (lock) {
            Deque<ChatRunEntry> queue = queues.get(sessionId);
            return queue != null ? queue.peekFirst() : null;
        }
    }

    public ChatRunEntry shift(String sessionId) {
        synchronized (lock) {
            Deque<ChatRunEntry> queue = queues.get(sessionId);
            if (queue == null) {
                return null;
            }
            ChatRunEntry entry = queue.pollFirst();
            if (queue.isEmpty()) {
                queues.remove(sessionId);
            }
            return entry;
        }
    }

    /**
     * Removes the first entry with the given client run id (and session key,
     * when supplied) regardless of its position.
     */
    public ChatRunEntry remove(String sessionId, String clientRunId, String sessionKey) {
        if (clientRunId == null) {
            return null;
        }
        synchronized (lock) {
            Deque<ChatRunEntry> queue = queues.get(sessionId);
            if (queue == null) {
                return null;
            }
            ChatRunEntry removed = null;
            Iterator<ChatRunEntry> iterator = queue.iterator();
            while (iterator.hasNext()) {
                ChatRunEntry entry = iterator.next();
                if (clientRunId.equals(entry.clientRunId())
                        && (StringValueSupport.isBlank(sessionKey) || sessionKey.equals(entry.sessionKey()))) {
                    iterator.remove();
                    removed = entry;
                    break;
                }
            }
            if (queue.isEmpty()) {
                queues.remove(sessionId);
            }
            return removed;
        }
    }

    public int pendingCount(String sessionId) {
        synchronized (lock) {
            Deque<ChatRunEntry> queue = queues.get(sessionId);
            return queue != null ? queue.size() : 0;
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return queues.isEmpty();
        }
    }

    public void clear() {
        synchronized (lock) {
            queues.clear();
        }
    }
}

package com.ramsbaby.notifier.component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ramsbaby.notifier.dto.ChatCommand;
import com.ramsbaby.notifier.dto.LinkButton;

import lombok.extern.slf4j.Slf4j;

/**
 * 텔레그램 Bot API 클라이언트. 봇 토큰 하나당 인스턴스 하나.
 */
@Slf4j
public class TelegramBotClient implements MessageGateway {

    static final int SEND_RETRIES = 3;
    static final Duration RETRY_BASE_DELAY = Duration.ofSeconds(1);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final String token;
    private final String apiBaseUrl;
    private final HttpClient http;
    private final ObjectMapper om;
    private final Sleeper sleeper;

    public TelegramBotClient(String name, String token, String apiBaseUrl, HttpClient http, ObjectMapper om,
            Sleeper sleeper) {
        this.name = name;
        this.token = token;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.http = http;
        this.om = om;
        this.sleeper = sleeper;
    }

    public String name() {
        return name;
    }

    @Override
    public void send(long chatId, String text) {
        send(chatId, text, null);
    }

    @Override
    public void send(long chatId, String text, LinkButton button) {
        sendMessage(chatId, text, button, SEND_RETRIES);
    }

    @Override
    public void sendOnce(long chatId, String text) {
        sendMessage(chatId, text, null, 1);
    }

    private void sendMessage(long chatId, String text, LinkButton button, int attempts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "MarkdownV2");
        body.put("disable_web_page_preview", true);
        if (button != null) {
            body.put("reply_markup", Map.of("inline_keyboard",
                    List.of(List.of(Map.of("text", button.label(), "url", button.url())))));
        }

        HttpRequest req = HttpRequest.newBuilder(methodUri("sendMessage"))
                .header("Content-Type", "application/json")
                .timeout(REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();

        HttpResponse<String> res = execute(req, chatId, attempts);
        JsonNode node = readTree(res.body());
        if (res.statusCode() != 200 || node == null || !node.path("ok").asBoolean(false)) {
            String description = node == null ? abbreviate(res.body()) : node.path("description").asText("");
            throw new DeliveryException("[" + name + "] sendMessage 실패 chat=" + chatId
                    + " HTTP " + res.statusCode() + " " + description);
        }
    }

    // 네트워크 오류/타임아웃만 1s, 2s 간격으로 재시도
    private HttpResponse<String> execute(HttpRequest req, long chatId, int attempts) {
        Duration delay = RETRY_BASE_DELAY;
        for (int attempt = 1; ; attempt++) {
            try {
                return http.send(req, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                if (attempt >= attempts) {
                    log.warn("[{}] chat {} 전송 타임아웃/네트워크 오류, {}회 시도 후 포기", name, chatId, attempts);
                    throw new DeliveryException("[" + name + "] 네트워크 오류: " + e.getMessage(), e);
                }
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new DeliveryException("[" + name + "] 전송 중단", ie);
                }
                delay = delay.multipliedBy(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeliveryException("[" + name + "] 전송 중단", e);
            }
        }
    }

    /**
     * getUpdates 롱 폴링. 텍스트 메시지만 돌려준다.
     */
    public List<ChatCommand> fetchUpdates(long offset, Duration pollTimeout) {
        String query = "?offset=" + offset + "&timeout=" + pollTimeout.toSeconds()
                + "&allowed_updates=%5B%22message%22%5D";
        HttpRequest req = HttpRequest.newBuilder(URI.create(methodUri("getUpdates") + query))
                .timeout(pollTimeout.plusSeconds(10))
                .GET()
                .build();
        HttpResponse<String> res;
        try {
            res = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("[" + name + "] getUpdates 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("[" + name + "] getUpdates 중단", e);
        }

        JsonNode node = readTree(res.body());
        if (res.statusCode() != 200 || node == null || !node.path("ok").asBoolean(false)) {
            throw new DeliveryException("[" + name + "] getUpdates HTTP " + res.statusCode() + " "
                    + abbreviate(res.body()));
        }
        List<ChatCommand> out = new ArrayList<>();
        for (JsonNode u : node.path("result")) {
            JsonNode msg = u.path("message");
            long updateId = u.path("update_id").asLong();
            if (msg.isMissingNode() || !msg.hasNonNull("text") || !msg.path("chat").has("id")) {
                out.add(new ChatCommand(updateId, 0L, null));
                continue;
            }
            out.add(new ChatCommand(updateId, msg.path("chat").path("id").asLong(), msg.path("text").asText()));
        }
        return out;
    }

    private URI methodUri(String method) {
        return URI.create(apiBaseUrl + "/bot" + token + "/" + method);
    }

    private String toJson(Object body) {
        try {
            return om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("요청 직렬화 실패", e);
        }
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank())
            return null;
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body != null && body.length() > 300)
            return body.substring(0, 300) + "...";
        return body;
    }
}

package com.ramsbaby.notifier.component;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ramsbaby.notifier.dto.ChatCommand;
import com.ramsbaby.notifier.dto.LinkButton;

@ExtendWith(MockitoExtension.class)
class TelegramBotClientTest {

    @Mock
    private HttpClient http;
    @Mock
    private Sleeper sleeper;

    private TelegramBotClient client;

    @BeforeEach
    void setUp() {
        client = new TelegramBotClient("appointment-bot", "appt-token", "https://api.telegram.org/", http,
                new ObjectMapper(), sleeper);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> res = mock(HttpResponse.class);
        when(res.statusCode()).thenReturn(status);
        when(res.body()).thenReturn(body);
        return res;
    }

    @Test
    void sendPostsToSendMessage() throws Exception {
        doReturn(response(200, "{\"ok\":true,\"result\":{\"message_id\":1}}")).when(http).send(any(), any());

        client.send(100L, "*hi*", new LinkButton("참여하기", "https://meet.example.com/x"));

        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertThat(req.getValue().method()).isEqualTo("POST");
        assertThat(req.getValue().uri().toString()).isEqualTo("https://api.telegram.org/botappt-token/sendMessage");
        assertThat(req.getValue().headers().firstValue("Content-Type")).contains("application/json");
        verify(sleeper, never()).sleep(any());
    }

    @Test
    void apiErrorIsNotRetried() throws Exception {
        doReturn(response(400, "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}"))
                .when(http).send(any(), any());

        assertThatThrownBy(() -> client.send(100L, "hi"))
                .isInstanceOf(DeliveryException.class)
                .hasMessageContaining("chat not found")
                .hasMessageContaining("HTTP 400");
        verify(http, times(1)).send(any(), any());
    }

    @Test
    void networkErrorIsRetriedWithBackoff() throws Exception {
        HttpResponse<String> ok = response(200, "{\"ok\":true}");
        doThrow(new HttpTimeoutException("timeout"))
                .doReturn(ok)
                .when(http).send(any(), any());

        client.send(100L, "hi");

        verify(http, times(2)).send(any(), any());
        verify(sleeper).sleep(Duration.ofSeconds(1));
    }

    @Test
    void givesUpAfterThreeNetworkErrors() throws Exception {
        doThrow(new HttpTimeoutException("timeout")).when(http).send(any(), any());

        assertThatThrownBy(() -> client.send(100L, "hi")).isInstanceOf(DeliveryException.class);

        verify(http, times(3)).send(any(), any());
        verify(sleeper).sleep(Duration.ofSeconds(1));
        verify(sleeper).sleep(Duration.ofSeconds(2));
    }

    @Test
    void sendOnceDoesNotRetryNetworkErrors() throws Exception {
        doThrow(new HttpTimeoutException("timeout")).when(http).send(any(), any());

        assertThatThrownBy(() -> client.sendOnce(100L, "digest")).isInstanceOf(DeliveryException.class);

        verify(http, times(1)).send(any(), any());
        verify(sleeper, never()).sleep(any());
    }

    @Test
    void fetchUpdatesKeepsOnlyTextMessages() throws Exception {
        String body = """
                {"ok":true,"result":[
                  {"update_id":10,"message":{"chat":{"id":100},"text":"/today"}},
                  {"update_id":11,"message":{"chat":{"id":100},"sticker":{}}},
                  {"update_id":12,"edited_message":{"chat":{"id":200},"text":"/check"}}
                ]}""";
        doReturn(response(200, body)).when(http).send(any(), any());

        List<ChatCommand> updates = client.fetchUpdates(10L, Duration.ofSeconds(30));

        assertThat(updates).extracting(ChatCommand::updateId, ChatCommand::chatId, ChatCommand::text)
                .containsExactly(tuple(10L, 100L, "/today"), tuple(11L, 0L, null), tuple(12L, 0L, null));

        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertThat(req.getValue().uri().toString())
                .startsWith("https://api.telegram.org/botappt-token/getUpdates?offset=10&timeout=30");
    }

    @Test
    void fetchUpdatesFailsOnBadResponse() throws Exception {
        doReturn(response(502, "Bad Gateway")).when(http).send(any(), any());

        assertThatThrownBy(() -> client.fetchUpdates(0L, Duration.ofSeconds(30)))
                .isInstanceOf(DeliveryException.class)
                .hasMessageContaining("502");
    }
}

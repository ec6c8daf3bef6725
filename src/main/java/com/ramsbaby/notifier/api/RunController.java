package com.ramsbaby.notifier.api;

import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ramsbaby.notifier.component.AgendaScheduler;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/run")
@RequiredArgsConstructor
public class RunController {
    private final AgendaScheduler agenda;
    private final TaskExecutor notifierTaskScheduler;

    // 요일/시각 조건 없이 아젠다를 발송. 재시도가 길어질 수 있어 스케줄러 스레드에서 돌린다
    @GetMapping
    public ResponseEntity<String> run() {
        if (!agenda.isReady())
            return ResponseEntity.status(HttpStatus.CONFLICT).body("NOT_READY");
        notifierTaskScheduler.execute(agenda::sendDigest);
        return ResponseEntity.accepted().body("OK");
    }
}

package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import org.springframework.stereotype.Service;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.MailItem;

import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.FlagTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class ImapMailReader {

    private static final String NO_SUBJECT = "(제목 없음)";

    private final AppProps props;
    private final Clock clock;

    private Properties sessionProperties() {
        Properties p = new Properties();
        p.put("mail.store.protocol", "imaps");
        p.put("mail.imaps.host", props.mail().imap().host());
        p.put("mail.imaps.port", String.valueOf(props.mail().imap().port()));
        p.put("mail.imaps.ssl.enable", "true");
        p.put("mail.imaps.connectiontimeout", "10000");
        p.put("mail.imaps.timeout", "30000");
        p.put("mail.mime.allowutf8", "true");
        return p;
    }

    /**
     * 받은편지함의 읽지 않은 메일을 최신순으로 읽는다. READ_ONLY 로 열어 SEEN 플래그는 건드리지 않는다.
     */
    public List<MailItem> loadUnread() {
        Session session = Session.getInstance(sessionProperties());
        try (Store store = session.getStore("imaps")) {
            store.connect(props.mail().user(), props.mail().pass());
            Folder inbox = store.getFolder(props.mail().folderOrInbox());
            inbox.open(Folder.READ_ONLY);

            Message[] found = inbox.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));

            FetchProfile fp = new FetchProfile();
            fp.add(FetchProfile.Item.ENVELOPE);
            fp.add(FetchProfile.Item.CONTENT_INFO);
            fp.add(UIDFolder.FetchProfileItem.UID);
            fp.add("Message-ID");
            inbox.fetch(found, fp);

            List<MailItem> out = new ArrayList<>();
            for (Message m : found) {
                toMailItem(inbox, m).ifPresent(out::add);
            }
            inbox.close(false);
            out.sort(Comparator.comparing(MailItem::receivedAt).reversed());
            return out;
        } catch (AuthenticationFailedException e) {
            throw new ProviderAuthException("IMAP 인증 실패: " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw new ProviderUnavailableException("IMAP 읽기 실패: " + e.getMessage(), e);
        }
    }

    private Optional<MailItem> toMailItem(Folder folder, Message m) {
        try {
            String id = messageId(folder, m);
            if (id == null) {
                log.warn("메일 ID를 알 수 없어 건너뜀: {}", m.getSubject());
                return Optional.empty();
            }
            String subject = Optional.ofNullable(m.getSubject()).filter(s -> !s.isBlank()).orElse(NO_SUBJECT);
            String body = extractText(m).or(() -> extractHtml(m)).orElse("");
            return Optional.of(new MailItem(id, subject, senderOf(m), receivedAt(m), MailPreviews.build(body), false));
        } catch (MessagingException e) {
            log.warn("메일 파싱 오류: {}", e.toString());
            return Optional.empty();
        }
    }

    private static String messageId(Folder folder, Message m) throws MessagingException {
        String[] header = m.getHeader("Message-ID");
        if (header != null && header.length > 0 && !header[0].isBlank())
            return header[0].trim();
        if (folder instanceof UIDFolder uf) {
            long uid = uf.getUID(m);
            return uid > 0 ? "uid:" + uid : null;
        }
        return null;
    }

    private static String senderOf(Message m) throws MessagingException {
        Address[] from = m.getFrom();
        if (from == null || from.length == 0)
            return "";
        if (from[0] instanceof InternetAddress ia)
            return ia.getPersonal() != null && !ia.getPersonal().isBlank() ? ia.getPersonal() : ia.getAddress();
        return from[0].toString();
    }

    private Instant receivedAt(Message m) throws MessagingException {
        Date d = m.getReceivedDate() != null ? m.getReceivedDate() : m.getSentDate();
        return d != null ? d.toInstant() : Instant.now(clock);
    }

    private Optional<String> extractHtml(Part p) {
        return findPart(p, "text/html");
    }

    private Optional<String> extractText(Part p) {
        return findPart(p, "text/plain");
    }

    private Optional<String> findPart(Part p, String mimeType) {
        try {
            if (p.isMimeType(mimeType))
                return Optional.of((String) p.getContent());
            if (p.isMimeType("multipart/*")) {
                Multipart mp = (Multipart) p.getContent();
                for (int i = 0; i < mp.getCount(); i++) {
                    var r = findPart(mp.getBodyPart(i), mimeType);
                    if (r.isPresent())
                        return r;
                }
            }
            if (p.isMimeType("message/rfc822"))
                return findPart((Part) p.getContent(), mimeType);
            return Optional.empty();
        } catch (Exception e) {
            log.debug("본문 파트 읽기 실패({}): {}", mimeType, e.toString());
            return Optional.empty();
        }
    }
}

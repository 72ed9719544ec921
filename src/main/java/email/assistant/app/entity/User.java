package email.assistant.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = "token")
@EqualsAndHashCode(of = "id")
public class User {
    @Id
    private String id;

    private String primaryEmail;

    @Embedded
    private OAuthToken token;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_vip_senders", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "sender")
    private List<String> vipSenders = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_urgent_keywords", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "keyword")
    private List<String> urgentKeywords = new ArrayList<>();

    // Intent the cached embeddings were computed for
    @Column(columnDefinition = "TEXT")
    private String lastIntent;
}

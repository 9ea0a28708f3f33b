package com.responseready.apigateway.auth.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "account_activities")
public class AccountActivityEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id")
  private AccountEntity account;

  @Column(name = "action", nullable = false, length = 32)
  private String action;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "ip", length = 64)
  private String ip;

  @Column(name = "user_agent", length = 256)
  private String userAgent;

  @Column(name = "referer", length = 512)
  private String referer;

  protected AccountActivityEntity() {}

  public AccountActivityEntity(
      AccountEntity account,
      String action,
      Instant createdAt,
      String ip,
      String userAgent,
      String referer) {
    this.account = account;
    this.action = action;
    this.createdAt = createdAt;
    this.ip = ip;
    this.userAgent = userAgent;
    this.referer = referer;
  }

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public AccountEntity getAccount() {
    return account;
  }

  public String getAction() {
    return action;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getIp() {
    return ip;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    AccountActivityEntity that = (AccountActivityEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}

package fleet.dashboard.service;

/** 리소스별 캐시 TTL (초) */
public final class TtlPresets {

  public static final long ENDPOINTS = 900;
  public static final long CONTAINERS = 300;
  public static final long STACKS = 600;
  public static final long IMAGES = 600;
  public static final long NETWORKS = 600;
  public static final long STATS = 60;

  private TtlPresets() {}
}
